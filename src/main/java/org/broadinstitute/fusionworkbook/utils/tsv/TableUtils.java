package org.broadinstitute.fusionworkbook.utils.tsv;

import org.apache.poi.ss.usermodel.Sheet;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Collection;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Common constants and factories for table readers and writers.
 */
public final class TableUtils {

    /**
     * Column separator {@value #COLUMN_SEPARATOR_STRING}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    /**
     * Column separator as an string.
     */
    public static final String COLUMN_SEPARATOR_STRING = String.valueOf(COLUMN_SEPARATOR);

    /**
     * Separator for comma-separated inputs.
     */
    public static final char COMMA_SEPARATOR = ',';

    /**
     * Comment line prefix string {@value}.
     * <p>
     * Lines that start with this prefix (spaces are not ignored), will be considered comment
     * lines (neither a header line nor data line) by readers that use the default {@link TableReaderOptions}.
     * </p>
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character {@value #QUOTE_STRING}.
     * <p>
     * Character used to quote table values that contain special characters.
     * </p>
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Quote character as a string.
     */
    public static final String QUOTE_STRING = String.valueOf(QUOTE_CHARACTER);

    /**
     * Escape character {@value #ESCAPE_STRING}.
     */
    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Escape character as a string.
     */
    public static final String ESCAPE_STRING = String.valueOf(ESCAPE_CHARACTER);

    private TableUtils() {}

    /**
     * Checks that a column collection contains all the mandatory columns.
     *
     * @param columns          the column collection to check.
     * @param mandatoryColumns the names that must be present.
     * @param exceptionFactory produces the exception to throw given the name of the first missing column.
     * @throws RuntimeException if any mandatory column is missing; the exact type depends on {@code exceptionFactory}.
     */
    public static void checkMandatoryColumns(final TableColumnCollection columns, final List<String> mandatoryColumns,
                                             final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columns, "columns cannot be null");
        Utils.nonNull(mandatoryColumns, "mandatory columns cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");
        final List<String> missing = columns.missing(mandatoryColumns);
        if (!missing.isEmpty()) {
            throw Utils.nonNull(exceptionFactory.apply(missing.get(0)), "exception factory produces null exceptions");
        }
    }

    /**
     * Creates a new table writer given the destination sheet, columns and the record to data-line composer.
     *
     * @param sheet          the destination sheet.
     * @param columns        the output table columns.
     * @param numericColumns the columns written as numeric cells.
     * @param composer       writes the record values into the data-line.
     * @param <R>            the record type.
     * @return never {@code null}.
     */
    public static <R> TableWriter<R> writer(final Sheet sheet, final TableColumnCollection columns,
                                            final Collection<String> numericColumns,
                                            final BiConsumer<R, DataLine> composer) {
        Utils.nonNull(composer, "the composer cannot be null");
        return new TableWriter<R>(sheet, columns, numericColumns) {
            @Override
            protected void composeLine(final R record, final DataLine dataLine) {
                composer.accept(record, dataLine);
            }
        };
    }
}
