package org.broadinstitute.fusionworkbook.utils.tsv;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * Serves as a bridge between the string array that holds the values of a line in a tab-separated table and the
 * typed records produced by a {@link TableReader} or consumed by a {@link TableWriter}.
 * </p>
 * <p>
 * Values are accessed by column name or index. Typed getters report conversion failures through the
 * format error factory supplied at construction, so that readers can attach the source and line to the message.
 * </p>
 */
public final class DataLine {

    /**
     * Holds the values for the data line in construction.
     */
    private final String[] values;

    /**
     * 1-based line number in the source, or in the output for lines being written.
     */
    private final long lineNumber;

    /**
     * Reference to the enclosing table's columns.
     */
    private final TableColumnCollection columns;

    /**
     * Reference to the format error exception factory.
     */
    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance.
     * <p>
     * The value array passed is not copied and will be used directly to store the data-line values.
     * </p>
     *
     * @param lineNumber         the line number of this data-line in its table.
     * @param values             the value array.
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when there is a column formatting error based on the requested data-type.
     * @throws IllegalArgumentException if {@code values}, {@code columns} or {@code formatErrorFactory} are {@code null},
     *                                  or the number of values does not match the number of columns.
     */
    DataLine(final long lineNumber, final String[] values, final TableColumnCollection columns,
             final Function<String, RuntimeException> formatErrorFactory) {
        this.lineNumber = lineNumber;
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new empty data-line instance.
     *
     * @param lineNumber         the line number this data-line will have once written.
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when there is a column formatting error based on the requested data-type.
     * @throws IllegalArgumentException if {@code columns} or {@code formatErrorFactory} are {@code null}.
     */
    public DataLine(final long lineNumber, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(lineNumber, new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    /**
     * Returns the column collection for this data-line instance.
     *
     * @return never {@code null}.
     */
    public TableColumnCollection columns() {
        return columns;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     *
     * @return never {@code null} and with no {@code null} elements.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    public DataLine set(final String name, final String value) {
        return set(columnIndex(name), value);
    }

    public DataLine set(final String name, final boolean value) {
        return set(columnIndex(name), Boolean.toString(value));
    }

    public DataLine set(final String name, final int value) {
        return set(columnIndex(name), Integer.toString(value));
    }

    public DataLine set(final String name, final long value) {
        return set(columnIndex(name), Long.toString(value));
    }

    public DataLine set(final String name, final double value) {
        return set(columnIndex(name), Double.toString(value));
    }

    /**
     * Sets the string value of a column by its index.
     *
     * @param index the target column index.
     * @param value the new value, {@code null} is not allowed.
     * @return reference to this data-line.
     * @throws IllegalArgumentException if {@code index} is not a valid column index or {@code value} is {@code null}.
     */
    public DataLine set(final int index, final String value) {
        Utils.validIndex(index, values.length);
        values[index] = Utils.nonNull(value, "the value cannot be null");
        return this;
    }

    /**
     * Returns the string value in a column by its index.
     *
     * @param index the target column index.
     * @return never {@code null}.
     * @throws IllegalArgumentException if {@code index} is not a valid column index.
     * @throws IllegalStateException    if the value for that column is undefined ({@code null}).
     */
    public String get(final int index) {
        Utils.validIndex(index, values.length);
        if (values[index] == null) {
            throw new IllegalStateException("requested column value at " + index + " has not been initialized yet");
        }
        return values[index];
    }

    /**
     * Returns the string value in a column by its name.
     *
     * @param columnName the target column name.
     * @return never {@code null}.
     * @throws IllegalArgumentException if {@code columnName} is {@code null} or an unknown column name.
     * @throws IllegalStateException    if that column values is undefined ({@code null}).
     */
    public String get(final String columnName) {
        return get(columnIndex(columnName));
    }

    /**
     * Returns the string value in a column by its name. If there is no such column, or its value is blank,
     * returns the default value.
     *
     * @param columnName   the target column name.
     * @param defaultValue default value to use if {@code columnName} is not found or its value is blank.
     * @return {@code null} iff {@code defaultValue == null} and there is not a non-blank value for that column.
     */
    public String get(final String columnName, final String defaultValue) {
        final int index = columns.indexOf(columnName);
        if (index < 0 || StringUtils.isBlank(values[index])) {
            return defaultValue;
        } else {
            return values[index];
        }
    }

    /**
     * Returns the int value in a column by its name.
     *
     * @throws RuntimeException if the value cannot be transformed into an integer. The exact class of the
     *                          exception depends on the format error factory.
     */
    public int getInt(final String columnName) {
        final String value = get(columnName).trim();
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found '%s'", columnName, value));
        }
    }

    public double getDouble(final String columnName) {
        final String value = get(columnName).trim();
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected double value for column %s but found '%s'", columnName, value));
        }
    }

    /**
     * Returns the index of a column by its name or fails if invalid or unknown.
     *
     * @param columnName the column name.
     * @return a valid index for {@link #values}.
     * @throws IllegalArgumentException if {@code columnName} is {@code null} or not a known column name.
     */
    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }

    /**
     * Returns a copy of the values in this data-line.
     */
    public String[] toArray() {
        return values.clone();
    }
}
