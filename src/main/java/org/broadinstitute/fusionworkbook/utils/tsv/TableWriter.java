package org.broadinstitute.fusionworkbook.utils.tsv;

import org.apache.commons.lang3.math.NumberUtils;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Collection;

/**
 * Class to write table records as the rows of a spreadsheet sheet.
 * <p>
 * The header row is written lazily: before the first record, or on {@link #close} when there are no records,
 * so a sheet with no rows still lists its columns.
 * </p>
 * <p>
 * Values of the numeric columns given at construction are stored as numeric cells when they parse as a number,
 * every other value as text. Empty values leave the cell blank.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements AutoCloseable {

    /**
     * Number of rows written so far, header included.
     */
    private int rowNumber;

    private final Sheet sheet;

    private final TableColumnCollection columns;

    private final boolean[] numericColumns;

    private boolean headerWritten = false;

    /**
     * Creates a new table writer given the destination sheet and the table columns.
     *
     * @param sheet          the destination sheet, expected to be empty.
     * @param columns        the table columns.
     * @param numericColumns names of the columns whose values are numbers; they need not be in {@code columns}.
     * @throws IllegalArgumentException if any argument is {@code null}.
     */
    public TableWriter(final Sheet sheet, final TableColumnCollection columns, final Collection<String> numericColumns) {
        this.sheet = Utils.nonNull(sheet, "the sheet cannot be null");
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        Utils.nonNull(numericColumns, "the numeric columns cannot be null");
        this.numericColumns = new boolean[columns.columnCount()];
        for (int i = 0; i < this.numericColumns.length; i++) {
            this.numericColumns[i] = numericColumns.contains(columns.nameAt(i));
        }
    }

    /**
     * Writes a new record.
     *
     * @param record the record to write.
     * @throws IllegalArgumentException if {@code record} is {@code null}.
     * @throws IllegalStateException    if {@link #composeLine} leaves a column undefined.
     */
    public void writeRecord(final R record) {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(rowNumber + 1, columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writeRow(dataLine.unpack(), true);
    }

    /**
     * Writes all the records in an iterable, in the iteration order.
     */
    public final void writeAllRecords(final Iterable<R> records) {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    /**
     * @return the number of data rows written so far.
     */
    public int getRecordCount() {
        return Math.max(0, rowNumber - 1);
    }

    @Override
    public final void close() {
        writeHeaderIfApplies();
    }

    /**
     * Writes the header if it has not been written already.
     */
    public void writeHeaderIfApplies() {
        if (!headerWritten) {
            writeRow(columns.names().toArray(new String[columns.columnCount()]), false);
            // keeps the header in view while scrolling
            sheet.createFreezePane(0, 1);
        }
        headerWritten = true;
    }

    private void writeRow(final String[] values, final boolean typed) {
        final Row row = sheet.createRow(rowNumber++);
        for (int i = 0; i < values.length; i++) {
            if (values[i].isEmpty()) {
                continue;
            }
            final double number = typed && numericColumns[i] ? NumberUtils.toDouble(values[i], Double.NaN) : Double.NaN;
            if (Double.isNaN(number)) {
                row.createCell(i).setCellValue(values[i]);
            } else {
                row.createCell(i).setCellValue(number);
            }
        }
    }

    /**
     * Composes the data-line to write given a record.
     * <p>
     * Every column must be set; use an empty string for a blank cell.
     * </p>
     *
     * @param record   the record to write.
     * @param dataLine the destination data-line object.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
