package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataValidation;
import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.testutils.WorkbookReader;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.parsers.ArribaParser;
import org.broadinstitute.fusionworkbook.tools.fusion.parsers.StarFusionParser;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.HistoricalCallsLoader;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

public final class FusionWorkbookWriterUnitTest extends FusionWorkbookTestBase {

    private Path workbookFile;
    private WorkbookReader workbook;

    @BeforeClass
    public void writeFixtureWorkbook() throws IOException {
        final FusionWorkbook fixture = new FusionWorkbookEngine(0, false, 1_000_000)
                .run(FusionWorkbookEngineUnitTest.fixtureInputs().build());
        final Path output = createTempDir("workbook").toPath();
        workbookFile = new FusionWorkbookWriter(output).write(fixture);
        Assert.assertEquals(workbookFile, output.resolve("250101_PCAN" + FusionWorkbookWriter.WORKBOOK_FILE_SUFFIX));
        Assert.assertTrue(Files.isRegularFile(workbookFile));
        workbook = new WorkbookReader(workbookFile);
    }

    @AfterClass(alwaysRun = true)
    public void closeWorkbook() throws IOException {
        if (workbook != null) {
            workbook.close();
        }
    }

    @Test
    public void testSheetOrder() {
        Assert.assertEquals(workbook.sheetNames(), Arrays.asList("Summary", "STAR-Fusion", "Fusion_Inspector", "Arriba",
                "FastQC", "FastQC_Pivot", "PC1_PC20_Predicted", "Skipped_Rows"));
    }

    @DataProvider(name = "sheets")
    public Object[][] sheets() {
        return new Object[][]{
                {FusionWorkbookWriter.SUMMARY_SHEET, 5},
                {"STAR-Fusion", 5},
                {"Fusion_Inspector", 2},
                {"Arriba", 2},
                {FusionWorkbookWriter.FASTQC_SHEET, 45},
                {FusionWorkbookWriter.FASTQC_PIVOT_SHEET, 3},
                {FusionWorkbookWriter.PREVIOUS_RUNS_SHEET, 4},
                {FusionWorkbookWriter.SKIPPED_ROWS_SHEET, 0},
        };
    }

    @Test(dataProvider = "sheets")
    public void testSheetRowCounts(final String sheet, final int rows) {
        Assert.assertEquals(workbook.rows(sheet).size(), rows);
    }

    @Test
    public void testCallSheetNames() {
        Assert.assertEquals(FusionWorkbookWriter.callSheetName(FusionSource.STAR_FUSION), "STAR-Fusion");
        Assert.assertEquals(FusionWorkbookWriter.callSheetName(FusionSource.FUSION_INSPECTOR), "Fusion_Inspector");
        Assert.assertEquals(FusionWorkbookWriter.callSheetName(FusionSource.ARRIBA), "Arriba");
    }

    @Test
    public void testSummarySheet() {
        final String sheet = FusionWorkbookWriter.SUMMARY_SHEET;
        Assert.assertEquals(workbook.header(sheet), FusionWorkbookWriter.SUMMARY_COLUMNS.names());

        final Map<String, String> first = workbook.rows(sheet).get(0);
        Assert.assertEquals(first.get(FusionWorkbookWriter.FUSION_NAME_COLUMN), "TMPRSS2--ERG");
        Assert.assertEquals(first.get(FusionWorkbookWriter.IDENTITY_COLUMN), "ERG--TMPRSS2");
        Assert.assertEquals(first.get(FusionWorkbookWriter.SPECIMENS_COLUMN), "S1,S2");
        Assert.assertEquals(first.get(FusionWorkbookWriter.LEFT_BREAKPOINT_COLUMN), "chr21:41508081:-");
        Assert.assertEquals(first.get(FusionWorkbookWriter.JUNCTION_READ_COUNT_COLUMN), "20");
        Assert.assertEquals(first.get(FusionWorkbookWriter.FFPM_COLUMN), "6.04");
        Assert.assertEquals(first.get(FusionWorkbookWriter.FRAME_COLUMN), "INFRAME");
        Assert.assertEquals(first.get(FusionWorkbookWriter.SOURCES_COLUMN), "STAR-Fusion,FusionInspector,Arriba");
        Assert.assertEquals(first.get(FusionWorkbookWriter.VALUE_SOURCES_COLUMN),
                "FUSION_NAME=STAR-Fusion;BREAKPOINTS=STAR-Fusion;JUNCTION_READ_COUNT=STAR-Fusion;SPANNING_FRAG_COUNT=STAR-Fusion;"
                        + "FFPM=STAR-Fusion;FRAME=FusionInspector;SPLICE_TYPE=STAR-Fusion");
        Assert.assertEquals(first.get(FusionWorkbookWriter.HISTORICAL_COUNT_COLUMN), "3");
        Assert.assertEquals(first.get(FusionWorkbookWriter.RECURRENT_COLUMN), "true");
        Assert.assertEquals(first.get(FusionWorkbookWriter.KNOWN_COLUMN), "false");
        Assert.assertEquals(first.get(FusionWorkbookWriter.REFERENCE_SOURCES_COLUMN), "");
        Assert.assertEquals(first.get(FusionWorkbookWriter.PREVIOUSLY_REPORTED_COLUMN), "true");
        Assert.assertEquals(first.get(FusionWorkbookWriter.PREVIOUS_POSITIVES_COLUMN), "S0107");
        // S1 and S2 together
        Assert.assertEquals(first.get(FusionWorkbookWriter.UNIQUE_READS_M_COLUMN), "3.25");
        Assert.assertEquals(first.get(FusionWorkbookWriter.DUPLICATE_READS_M_COLUMN), "1.75");
        Assert.assertEquals(first.get(FusionWorkbookWriter.REPORTED_COLUMN), "");
        Assert.assertEquals(first.get(FusionWorkbookWriter.ONCOGENICITY_COLUMN), "");

        Assert.assertEquals(workbook.cell(sheet, 0, FusionWorkbookWriter.JUNCTION_READ_COUNT_COLUMN).getCellType(), CellType.NUMERIC);
        Assert.assertEquals(workbook.cell(sheet, 0, FusionWorkbookWriter.FFPM_COLUMN).getNumericCellValue(), 6.04, 1e-9);
        Assert.assertEquals(workbook.cell(sheet, 0, FusionWorkbookWriter.FUSION_NAME_COLUMN).getCellType(), CellType.STRING);
        Assert.assertNull(workbook.cell(sheet, 0, FusionWorkbookWriter.REPORTED_COLUMN));
    }

    @Test
    public void testSummaryReviewDropDowns() {
        final List<? extends DataValidation> validations = workbook.sheet(FusionWorkbookWriter.SUMMARY_SHEET).getDataValidations();
        final Map<Integer, List<String>> listsByColumn = new HashMap<>();
        for (final DataValidation validation : validations) {
            listsByColumn.put(validation.getRegions().getCellRangeAddress(0).getFirstColumn(),
                    Arrays.asList(validation.getValidationConstraint().getExplicitListValues()));
        }
        Assert.assertEquals(listsByColumn.size(), 2);
        Assert.assertEquals(listsByColumn.get(FusionWorkbookWriter.SUMMARY_COLUMNS.indexOf(FusionWorkbookWriter.REPORTED_COLUMN)),
                FusionWorkbookWriter.REPORTED_VALUES);
        Assert.assertEquals(listsByColumn.get(FusionWorkbookWriter.SUMMARY_COLUMNS.indexOf(FusionWorkbookWriter.ONCOGENICITY_COLUMN)),
                FusionWorkbookWriter.ONCOGENICITY_VALUES);
    }

    @Test
    public void testPreviousRunsSheet() {
        final String sheet = FusionWorkbookWriter.PREVIOUS_RUNS_SHEET;
        Assert.assertEquals(workbook.header(sheet), Arrays.asList(HistoricalCallsLoader.FUSION_NAME_COLUMN, HistoricalCallsLoader.COUNT_COLUMN));
        final List<Map<String, String>> rows = workbook.rows(sheet);
        Assert.assertEquals(rows.get(0).get(HistoricalCallsLoader.FUSION_NAME_COLUMN), HistoricalCallsLoader.SAMPLES_ROW);
        Assert.assertEquals(rows.get(0).get(HistoricalCallsLoader.COUNT_COLUMN), "42");
        Assert.assertEquals(rows.get(3).get(HistoricalCallsLoader.FUSION_NAME_COLUMN), "GENEX--GENEY");
        Assert.assertEquals(rows.get(3).get(HistoricalCallsLoader.COUNT_COLUMN), "17");
    }

    @Test
    public void testStarFusionSheet() {
        final String sheet = "STAR-Fusion";
        final List<String> header = workbook.header(sheet);
        Assert.assertEquals(header.subList(header.size() - 6, header.size()), Arrays.asList(
                FusionWorkbookWriter.HISTORICAL_COUNT_COLUMN, FusionWorkbookWriter.REFERENCE_SOURCES_COLUMN,
                FusionWorkbookWriter.PREVIOUS_POSITIVES_COLUMN, FusionWorkbookWriter.IGV_NAME_COLUMN,
                FusionWorkbookWriter.FILE_COLUMN, FusionWorkbookWriter.LINE_COLUMN));
        Assert.assertTrue(header.contains(StarFusionParser.LARGE_ANCHOR_SUPPORT_COLUMN));

        final List<Map<String, String>> rows = workbook.rows(sheet);
        final Map<String, String> first = rows.get(0);
        Assert.assertEquals(first.get(FusionWorkbookWriter.FUSION_NAME_COLUMN), "TMPRSS2--ERG");
        Assert.assertEquals(first.get(FusionWorkbookWriter.SPECIMEN_COLUMN), "S1");
        Assert.assertEquals(first.get(FusionWorkbookWriter.JUNCTION_READ_COUNT_COLUMN), "12");
        Assert.assertEquals(first.get(FusionWorkbookWriter.FFPM_COLUMN), "3.2145");
        Assert.assertEquals(first.get(StarFusionParser.LARGE_ANCHOR_SUPPORT_COLUMN), "YES_LDAS");
        Assert.assertEquals(first.get(FusionWorkbookWriter.HISTORICAL_COUNT_COLUMN), "3");
        Assert.assertEquals(first.get(FusionWorkbookWriter.PREVIOUS_POSITIVES_COLUMN), "S0107");
        Assert.assertEquals(first.get(FusionWorkbookWriter.IGV_NAME_COLUMN), "250101-S1-PCAN");
        Assert.assertEquals(first.get(FusionWorkbookWriter.FILE_COLUMN), "250101-S1-PCAN-R1.star-fusion.fusion_predictions.abridged.tsv");
        Assert.assertEquals(first.get(FusionWorkbookWriter.LINE_COLUMN), "2");

        final Map<String, String> eml4Alk = rows.get(1);
        Assert.assertEquals(eml4Alk.get(FusionWorkbookWriter.REFERENCE_SOURCES_COLUMN), "COSMIC,FusionGDB2");
        Assert.assertEquals(rows.get(4).get(FusionWorkbookWriter.FUSION_NAME_COLUMN), "BCR--ABL1");
        Assert.assertEquals(rows.get(4).get(FusionWorkbookWriter.IGV_NAME_COLUMN), "250101-S2-PCAN");
    }

    @Test
    public void testArribaSheetCarriesItsFlags() {
        final List<Map<String, String>> rows = workbook.rows("Arriba");
        Assert.assertEquals(rows.get(1).get(FusionWorkbookWriter.FUSION_NAME_COLUMN), "KIF5B--RET");
        Assert.assertEquals(rows.get(1).get(ArribaParser.CONFIDENCE_COLUMN), "medium");
        Assert.assertEquals(rows.get(1).get(ArribaParser.TYPE_COLUMN), "inversion");
        Assert.assertEquals(rows.get(1).get(FusionWorkbookWriter.FFPM_COLUMN), "");
        Assert.assertEquals(rows.get(1).get(FusionWorkbookWriter.REFERENCE_SOURCES_COLUMN), "FusionGDB2");
    }

    @Test
    public void testPivotSheet() {
        final List<Map<String, String>> rows = workbook.rows(FusionWorkbookWriter.FASTQC_PIVOT_SHEET);
        Assert.assertEquals(rows.get(0).get(FusionWorkbookWriter.SPECIMEN_COLUMN), "S1");
        Assert.assertEquals(Double.parseDouble(rows.get(0).get(FusionWorkbookWriter.UNIQUE_READS_M_COLUMN)), 2.75, 1e-9);
        Assert.assertEquals(Double.parseDouble(rows.get(0).get(FusionWorkbookWriter.DUPLICATE_READS_M_COLUMN)), 1.25, 1e-9);
        Assert.assertEquals(rows.get(1).get(FusionWorkbookWriter.SPECIMEN_COLUMN), "S2");
        Assert.assertEquals(rows.get(2).get(FusionWorkbookWriter.SPECIMEN_COLUMN), QCSummary.TOTAL_LABEL);
        Assert.assertEquals(Double.parseDouble(rows.get(2).get(FusionWorkbookWriter.UNIQUE_READS_M_COLUMN)), 3.25, 1e-9);
        Assert.assertEquals(Double.parseDouble(rows.get(2).get(FusionWorkbookWriter.DUPLICATE_READS_M_COLUMN)), 1.75, 1e-9);
    }

    @Test
    public void testSkippedRowsSheetHeader() {
        Assert.assertEquals(workbook.header(FusionWorkbookWriter.SKIPPED_ROWS_SHEET),
                FusionWorkbookWriter.SKIPPED_ROWS_COLUMNS.names());
    }

    @Test
    public void testQCValuesKeepTheirType() {
        final List<Map<String, String>> rows = workbook.rows(FusionWorkbookWriter.FASTQC_SHEET);
        for (int i = 0; i < rows.size(); i++) {
            final CellType type = workbook.cell(FusionWorkbookWriter.FASTQC_SHEET, i, FusionWorkbookWriter.VALUE_COLUMN).getCellType();
            final boolean numeric = rows.get(i).get(FusionWorkbookWriter.VALUE_COLUMN).matches("-?[0-9.E+-]+");
            Assert.assertEquals(type, numeric ? CellType.NUMERIC : CellType.STRING, rows.get(i).toString());
        }
    }

    @Test(expectedExceptions = UserException.CouldNotCreateOutputFile.class)
    public void testUnwritableOutput() {
        final Path notADirectory = createTempPath("workbook", ".txt");
        final FusionWorkbook fixture = new FusionWorkbookEngine(0, false, 1_000_000)
                .run(FusionWorkbookEngineUnitTest.fixtureInputs().build());
        new FusionWorkbookWriter(notADirectory).write(fixture);
    }
}
