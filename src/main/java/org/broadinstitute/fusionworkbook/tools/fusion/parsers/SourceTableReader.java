package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.SkippedRow;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;
import org.broadinstitute.fusionworkbook.utils.tsv.TableColumnCollection;
import org.broadinstitute.fusionworkbook.utils.tsv.TableReader;
import org.broadinstitute.fusionworkbook.utils.tsv.TableReaderOptions;
import org.broadinstitute.fusionworkbook.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Table reader shared by the source parsers.
 * <p>
 * Fails with {@link UserException.SchemaViolation} when a required column is absent. Rows whose values cannot be
 * parsed, or whose value count does not match the header, are recorded as {@link SkippedRow}s and logged instead
 * of failing the whole file.
 * </p>
 *
 * @param <T> record type.
 */
abstract class SourceTableReader<T> extends TableReader<T> {

    private static final Logger logger = LogManager.getLogger(SourceTableReader.class);

    /**
     * Values that tools write for "no value".
     */
    private static final String[] MISSING_VALUES = {".", "NA", "N/A"};

    private final String sourceType;
    private final List<SkippedRow> skippedRows = new ArrayList<>();

    SourceTableReader(final String sourceType, final String fileName, final Reader reader,
                      final char columnSeparator) throws IOException {
        super(Utils.nonNull(fileName, "the file name cannot be null"), reader, TableReaderOptions.withoutComments(columnSeparator));
        this.sourceType = Utils.nonNull(sourceType);
    }

    SourceTableReader(final String sourceType, final String fileName, final Reader reader) throws IOException {
        this(sourceType, fileName, reader, TableUtils.COLUMN_SEPARATOR);
    }

    /**
     * Columns that must be present in the header.
     * <p>
     * Called while the header is processed, before subclass fields are initialized, so implementations must
     * return a constant.
     * </p>
     */
    protected abstract List<String> requiredColumns();

    /**
     * Transforms a data line into a record.
     *
     * @throws UserException.BadInput if the row cannot be parsed; the row is then skipped.
     */
    protected abstract T parseRow(final DataLine dataLine);

    @Override
    protected final void processColumns(final TableColumnCollection tableColumns) {
        TableUtils.checkMandatoryColumns(tableColumns, requiredColumns(),
                column -> new UserException.SchemaViolation(column, getSource()));
    }

    @Override
    protected final T createRecord(final DataLine dataLine) {
        try {
            return parseRow(dataLine);
        } catch (final UserException.BadInput e) {
            skip(dataLine.getLineNumber(), e.getMessage());
            return null;
        }
    }

    @Override
    protected final void onMalformedLine(final String[] values, final long lineNumber, final String message) {
        skip(lineNumber, message);
    }

    private void skip(final long lineNumber, final String reason) {
        final SkippedRow row = new SkippedRow(sourceType, getSource(), lineNumber, reason);
        logger.warn(row.toString());
        skippedRows.add(row);
    }

    /**
     * Reads every row.
     *
     * @param allowEmpty whether a file without data rows is acceptable.
     * @throws UserException.EmptyResult if no row produced a record, unless the file has no data rows at all
     *                                   and {@code allowEmpty} is set.
     */
    final ParseResult<T> readAll(final boolean allowEmpty) {
        final List<T> records = toList();
        if (records.isEmpty()) {
            if (!skippedRows.isEmpty() || !allowEmpty) {
                throw new UserException.EmptyResult(sourceType + " file " + getSource(), skippedRows.size());
            }
            logger.warn(String.format("%s file %s has no records", sourceType, getSource()));
        } else {
            logger.info(String.format("Read %d %s records from %s (%d rows skipped)",
                    records.size(), sourceType, getSource(), skippedRows.size()));
        }
        return new ParseResult<>(records, skippedRows);
    }

    /**
     * Parses a required non-negative count.
     */
    final int count(final DataLine dataLine, final String column) {
        final int value = dataLine.getInt(column);
        if (value < 0) {
            throw formatException(String.format("negative value for column %s: %d", column, value));
        }
        return value;
    }

    /**
     * @return the trimmed value of an optional column, {@code null} if the column is absent or the value missing.
     */
    final String optionalText(final DataLine dataLine, final String column) {
        final String value = dataLine.get(column, null);
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        for (final String missing : MISSING_VALUES) {
            if (missing.equals(trimmed)) {
                return null;
            }
        }
        return trimmed;
    }

    /**
     * @return the value of an optional numeric column, {@code null} if absent or missing.
     * @throws UserException.BadInput if present but not a number.
     */
    final Double optionalDouble(final DataLine dataLine, final String column) {
        return optionalText(dataLine, column) == null ? null : dataLine.getDouble(column);
    }

    /**
     * @return the value of a required text column.
     * @throws UserException.BadInput if it is blank.
     */
    final String requiredText(final DataLine dataLine, final String column) {
        final String value = dataLine.get(column).trim();
        if (value.isEmpty()) {
            throw formatException("empty value for column " + column);
        }
        return value;
    }
}
