package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;
import org.broadinstitute.fusionworkbook.utils.tsv.TableColumnCollection;
import org.broadinstitute.fusionworkbook.utils.tsv.TableReader;
import org.broadinstitute.fusionworkbook.utils.tsv.TableReaderOptions;
import org.broadinstitute.fusionworkbook.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Reader for the static reference files. Missing key columns are fatal; unusable rows are logged and ignored.
 */
abstract class ReferenceTableReader<R> extends TableReader<R> {

    private static final Logger logger = LogManager.getLogger(ReferenceTableReader.class);

    private int ignoredRows = 0;

    ReferenceTableReader(final String sourceName, final Reader reader, final char columnSeparator) throws IOException {
        this(sourceName, reader, TableReaderOptions.withoutComments(columnSeparator));
    }

    ReferenceTableReader(final String sourceName, final Reader reader, final TableReaderOptions options) throws IOException {
        super(sourceName, reader, options);
    }

    /**
     * Must return a constant: it is called while the header is read, before subclass fields are set.
     */
    protected abstract List<String> keyColumns();

    protected abstract R parseRow(final DataLine dataLine);

    @Override
    protected final void processColumns(final TableColumnCollection tableColumns) {
        TableUtils.checkMandatoryColumns(tableColumns, keyColumns(),
                column -> new UserException.SchemaViolation(column, getSource()));
    }

    @Override
    protected final R createRecord(final DataLine dataLine) {
        try {
            return parseRow(dataLine);
        } catch (final UserException.BadInput e) {
            ignore(dataLine.getLineNumber(), e.getMessage());
            return null;
        }
    }

    @Override
    protected final void onMalformedLine(final String[] values, final long lineNumber, final String message) {
        ignore(lineNumber, message);
    }

    private void ignore(final long lineNumber, final String reason) {
        ignoredRows++;
        logger.warn(String.format("Ignoring line %d of %s: %s", lineNumber, getSource(), reason));
    }

    final int getIgnoredRows() {
        return ignoredRows;
    }
}
