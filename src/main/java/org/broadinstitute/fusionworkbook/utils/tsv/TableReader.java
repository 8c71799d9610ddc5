package org.broadinstitute.fusionworkbook.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.io.IOUtils;

import java.io.Closeable;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reader class for tab or comma separated table files.
 * <p>
 * The first non-comment line is the header that names the columns. Every following non-comment, non-blank
 * line is a data line that is transformed into a record by {@link #createRecord}. Which lines are comments
 * and which character separates columns is decided by the {@link TableReaderOptions} given at construction.
 * </p>
 * <p>
 * Subclasses may check the header in {@link #processColumns}, skip a data line by returning {@code null} from
 * {@link #createRecord}, and override {@link #onMalformedLine} to tolerate lines whose value count does not
 * match the header.
 * </p>
 *
 * @param <R> record type.
 */
public abstract class TableReader<R> implements Closeable, Iterable<R> {

    /**
     * Name of the source, used in error messages. It can be {@code null}.
     */
    private final String source;

    private final LineNumberReader reader;

    private final TableReaderOptions options;

    private TableColumnCollection columns;

    private final CSVReader csvReader;

    /**
     * Whether the next record has been fetched already into {@link #nextRecord}.
     */
    private boolean nextRecordFetched = false;

    private R nextRecord;

    public TableReader(final Path path) throws IOException {
        this(path, new TableReaderOptions());
    }

    public TableReader(final Path path, final TableReaderOptions tableReaderOptions) throws IOException {
        this(IOUtils.getFileName(Utils.nonNull(path, "the input file cannot be null")),
                IOUtils.makeReaderMaybeGzipped(path), tableReaderOptions);
    }

    /**
     * Creates a new table reader given a source name and the underlying reader.
     *
     * @param sourceName         the name of the source, for error messages. It can be {@code null}.
     * @param sourceReader       the character stream to read the table from.
     * @param tableReaderOptions separator and comment choices.
     * @throws IllegalArgumentException if {@code sourceReader} or {@code tableReaderOptions} is {@code null}.
     * @throws IOException              if raised when reading the header.
     * @throws UserException.BadInput   if there is no header line or it is not valid.
     */
    public TableReader(final String sourceName, final Reader sourceReader,
                       final TableReaderOptions tableReaderOptions) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        this.options = Utils.nonNull(tableReaderOptions, "the options cannot be null");
        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, options.columnSeparator, TableUtils.QUOTE_CHARACTER, TableUtils.ESCAPE_CHARACTER);
        findAndProcessHeaderLine();
    }

    private void findAndProcessHeaderLine() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line) && !isBlankLine(line)) {
                final String[] names = Arrays.stream(line).map(String::trim)
                        .map(name -> options.headerAliases.getOrDefault(name, name))
                        .toArray(String[]::new);
                TableColumnCollection.checkNames(names, this::formatException);
                columns = new TableColumnCollection(names);
                processColumns(columns);
                return;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    /**
     * Checks whether a line is a comment line.
     * <p>
     * Only lines that start with the comment prefix of this reader options are comments; when the options
     * have no such prefix there are no comment lines.
     * </p>
     */
    protected boolean isCommentLine(final String[] line) {
        return options.commentPrefix != null && line.length > 0 && line[0].startsWith(options.commentPrefix);
    }

    private static boolean isBlankLine(final String[] line) {
        return line.length == 0 || (line.length == 1 && line[0].trim().isEmpty());
    }

    /**
     * Composes a format error exception that carries the source name and current line number.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d" + explanation, reader.getLineNumber()));
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d" + explanation, source, reader.getLineNumber()));
        }
    }

    /**
     * Process the header line's columns.
     * <p>
     * Subclasses throw an exception here if required columns are missing.
     * </p>
     *
     * @param tableColumns the header line columns.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    /**
     * Handles a data line whose number of values does not match the number of columns.
     * <p>
     * By default this throws a format exception. Subclasses that prefer to skip such lines can override it and
     * return normally, in which case the line is ignored.
     * </p>
     *
     * @param values     the values found in the line.
     * @param lineNumber the line number.
     * @param message    describes the mismatch.
     */
    protected void onMalformedLine(final String[] values, final long lineNumber, final String message) {
        throw formatException(message);
    }

    /**
     * Returns the column collection for this reader.
     *
     * @return never {@code null}.
     */
    public TableColumnCollection columns() {
        Utils.validate(columns != null, "columns are null");
        return columns;
    }

    /**
     * Reads the next record from the source.
     *
     * @return {@code null} if there is no more records.
     * @throws IOException if raised when reading from the source.
     */
    public final R readRecord() throws IOException {
        if (!nextRecordFetched) {
            nextRecord = fetchNextRecord();
        }
        nextRecordFetched = false;
        return nextRecord;
    }

    private R fetchNextRecord() throws IOException {
        nextRecordFetched = true;
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line) || isBlankLine(line)) {
                continue;
            }
            final long lineNumber = reader.getLineNumber();
            if (line.length != columns.columnCount()) {
                onMalformedLine(line, lineNumber,
                        String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
            } else {
                final R result = createRecord(new DataLine(lineNumber, line, columns, this::formatException));
                if (result != null) {
                    return result;
                }
            }
        }
        return null;
    }

    /**
     * Transforms a data-line into a record.
     *
     * @param dataLine the data line to transform.
     * @return {@code null} to skip the line.
     */
    protected abstract R createRecord(final DataLine dataLine);

    @Override
    public void close() throws IOException {
        csvReader.close();
    }

    @Override
    public Iterator<R> iterator() {
        return new Iterator<R>() {

            @Override
            public boolean hasNext() {
                if (!nextRecordFetched) {
                    try {
                        nextRecord = fetchNextRecord();
                    } catch (final IOException ex) {
                        throw new UncheckedIOException(ex);
                    }
                }
                return nextRecord != null;
            }

            @Override
            public R next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("there is no more record in the input");
                }
                nextRecordFetched = false;
                return nextRecord;
            }
        };
    }

    @Override
    public Spliterator<R> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
    }

    public Stream<R> stream() {
        return Utils.stream(this);
    }

    /**
     * Reads all remaining records into a list.
     */
    public List<R> toList() {
        return stream().collect(Collectors.toList());
    }

    /**
     * Returns the source name; {@code null} if none was given.
     */
    public String getSource() {
        return source;
    }
}
