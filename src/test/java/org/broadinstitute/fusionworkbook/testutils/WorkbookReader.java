package org.broadinstitute.fusionworkbook.testutils;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads back the sheets of a written .xlsx workbook as text, the way a user sees the cells.
 */
public final class WorkbookReader implements Closeable {

    private final XSSFWorkbook workbook;
    private final DataFormatter formatter = new DataFormatter();

    public WorkbookReader(final Path file) throws IOException {
        try (final InputStream in = Files.newInputStream(file)) {
            this.workbook = new XSSFWorkbook(in);
        }
    }

    public List<String> sheetNames() {
        final List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return names;
    }

    public Sheet sheet(final String name) {
        final Sheet sheet = workbook.getSheet(name);
        if (sheet == null) {
            throw new IllegalArgumentException("no such sheet: " + name);
        }
        return sheet;
    }

    /**
     * @return the first row of the sheet.
     */
    public List<String> header(final String sheetName) {
        final Row row = sheet(sheetName).getRow(0);
        final List<String> names = new ArrayList<>();
        for (int i = 0; i < row.getLastCellNum(); i++) {
            names.add(text(row.getCell(i)));
        }
        return names;
    }

    /**
     * @return one column-name to value map per data row; blank cells give empty strings.
     */
    public List<Map<String, String>> rows(final String sheetName) {
        final Sheet sheet = sheet(sheetName);
        final List<String> header = header(sheetName);
        final List<Map<String, String>> rows = new ArrayList<>();
        for (int r = 1; r <= sheet.getLastRowNum(); r++) {
            final Row row = sheet.getRow(r);
            final Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                values.put(header.get(c), row == null ? "" : text(row.getCell(c)));
            }
            rows.add(values);
        }
        return rows;
    }

    /**
     * @return the cell of a data row, 0 being the first row after the header; {@code null} when blank.
     */
    public Cell cell(final String sheetName, final int dataRow, final String column) {
        final Row row = sheet(sheetName).getRow(dataRow + 1);
        return row == null ? null : row.getCell(header(sheetName).indexOf(column));
    }

    private String text(final Cell cell) {
        return cell == null ? "" : formatter.formatCellValue(cell);
    }

    @Override
    public void close() throws IOException {
        workbook.close();
    }
}
