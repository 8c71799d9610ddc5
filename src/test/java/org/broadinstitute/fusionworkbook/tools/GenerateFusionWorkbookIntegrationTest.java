package org.broadinstitute.fusionworkbook.tools;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.fusionworkbook.CommandLineProgramTest;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.testutils.ArgumentsBuilder;
import org.broadinstitute.fusionworkbook.testutils.WorkbookReader;
import org.broadinstitute.fusionworkbook.tools.fusion.engine.FusionWorkbookWriter;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.HistoricalCallsLoader;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class GenerateFusionWorkbookIntegrationTest extends CommandLineProgramTest {

    private static ArgumentsBuilder fixtureArguments(final File output) {
        return fixtureArguments(output, "002_250101_PCAN");
    }

    private static ArgumentsBuilder fixtureArguments(final File output, final String projectName) {
        return new ArgumentsBuilder()
                .add(GenerateFusionWorkbook.STAR_FUSION_LONG_NAME, STAR_FUSION_S1)
                .add(GenerateFusionWorkbook.STAR_FUSION_LONG_NAME, STAR_FUSION_S2)
                .add(GenerateFusionWorkbook.FUSION_INSPECTOR_LONG_NAME, FUSION_INSPECTOR_S1)
                .add(GenerateFusionWorkbook.ARRIBA_LONG_NAME, ARRIBA_S1)
                .add(GenerateFusionWorkbook.FASTQC_LONG_NAME, FASTQC)
                .add(GenerateFusionWorkbook.PREVIOUS_RUNS_LONG_NAME, PREVIOUS_RUNS)
                .add(GenerateFusionWorkbook.REFERENCE_SOURCES_LONG_NAME, REFERENCE_SOURCES)
                .add(GenerateFusionWorkbook.PREVIOUS_POSITIVES_LONG_NAME, PREVIOUS_POSITIVES)
                .add(GenerateFusionWorkbook.PROJECT_NAME_LONG_NAME, projectName)
                .addOutput(output);
    }

    private static List<String> column(final Path workbookFile, final String sheet, final String columnName) throws IOException {
        try (final WorkbookReader workbook = new WorkbookReader(workbookFile)) {
            Assert.assertTrue(workbook.header(sheet).contains(columnName), columnName + " missing from " + sheet);
            return workbook.rows(sheet).stream().map(r -> r.get(columnName)).collect(Collectors.toList());
        }
    }

    private static Path workbookFile(final File output, final String prefix) {
        return output.toPath().resolve(prefix + FusionWorkbookWriter.WORKBOOK_FILE_SUFFIX);
    }

    @Test
    public void testFixtureRun() throws IOException {
        final File output = createTempDir("generateFusionWorkbook");
        final Object result = runCommandLine(fixtureArguments(output));

        final Path workbook = workbookFile(output, "250101_PCAN");
        Assert.assertEquals(result, workbook.toString());
        Assert.assertTrue(Files.isRegularFile(workbook));
        try (final WorkbookReader reader = new WorkbookReader(workbook)) {
            Assert.assertEquals(reader.sheetNames(), Arrays.asList(FusionWorkbookWriter.SUMMARY_SHEET, "STAR-Fusion",
                    "Fusion_Inspector", "Arriba", FusionWorkbookWriter.FASTQC_SHEET, FusionWorkbookWriter.FASTQC_PIVOT_SHEET,
                    FusionWorkbookWriter.PREVIOUS_RUNS_SHEET, FusionWorkbookWriter.SKIPPED_ROWS_SHEET));
            Assert.assertEquals(reader.header(FusionWorkbookWriter.SUMMARY_SHEET), FusionWorkbookWriter.SUMMARY_COLUMNS.names());
            Assert.assertEquals(reader.header(FusionWorkbookWriter.FASTQC_PIVOT_SHEET), FusionWorkbookWriter.FASTQC_PIVOT_COLUMNS.names());
            Assert.assertEquals(reader.header(FusionWorkbookWriter.SKIPPED_ROWS_SHEET), FusionWorkbookWriter.SKIPPED_ROWS_COLUMNS.names());
            Assert.assertEquals(reader.header("Fusion_Inspector").get(0), FusionWorkbookWriter.FUSION_NAME_COLUMN);
        }

        final String summary = FusionWorkbookWriter.SUMMARY_SHEET;
        Assert.assertEquals(column(workbook, summary, FusionWorkbookWriter.IDENTITY_COLUMN),
                Arrays.asList("ERG--TMPRSS2", "ALK--EML4", "GENEX--GENEY", "ABL1--BCR", "KIF5B--RET"));
        Assert.assertEquals(column(workbook, summary, FusionWorkbookWriter.HISTORICAL_COUNT_COLUMN), Arrays.asList("3", "0", "17", "0", "0"));
        Assert.assertEquals(column(workbook, summary, FusionWorkbookWriter.KNOWN_COLUMN), Arrays.asList("false", "true", "false", "true", "true"));
        Assert.assertEquals(column(workbook, summary, FusionWorkbookWriter.PREVIOUS_POSITIVES_COLUMN), Arrays.asList("S0107", "S0099", "", "S0107", ""));
        Assert.assertEquals(column(workbook, summary, FusionWorkbookWriter.UNIQUE_READS_M_COLUMN).get(0), "3.25");
        Assert.assertEquals(column(workbook, "Arriba", FusionWorkbookWriter.IGV_NAME_COLUMN),
                Arrays.asList("250101-S1-PCAN", "250101-S1-PCAN"));
    }

    @Test
    public void testPreviousRunsAndReviewColumns() throws IOException {
        final File output = createTempDir("generateFusionWorkbook");
        runCommandLine(fixtureArguments(output));
        final Path workbook = workbookFile(output, "250101_PCAN");

        Assert.assertEquals(column(workbook, FusionWorkbookWriter.PREVIOUS_RUNS_SHEET, HistoricalCallsLoader.FUSION_NAME_COLUMN),
                Arrays.asList(HistoricalCallsLoader.SAMPLES_ROW, "TMPRSS2--ERG", "ERG--TMPRSS2", "GENEX--GENEY"));
        Assert.assertEquals(column(workbook, FusionWorkbookWriter.PREVIOUS_RUNS_SHEET, HistoricalCallsLoader.COUNT_COLUMN),
                Arrays.asList("42", "3", "1", "17"));
        Assert.assertEquals(column(workbook, FusionWorkbookWriter.SUMMARY_SHEET, FusionWorkbookWriter.REPORTED_COLUMN),
                Collections.nCopies(5, ""));
        Assert.assertEquals(column(workbook, FusionWorkbookWriter.SUMMARY_SHEET, FusionWorkbookWriter.ONCOGENICITY_COLUMN),
                Collections.nCopies(5, ""));
    }

    @Test
    public void testReferenceInputsAreOptional() throws IOException {
        final File output = createTempDir("generateFusionWorkbook");
        runCommandLine(new ArgumentsBuilder()
                .add(GenerateFusionWorkbook.STAR_FUSION_LONG_NAME, STAR_FUSION_S1)
                .add(GenerateFusionWorkbook.STAR_FUSION_LONG_NAME, STAR_FUSION_S2)
                .add(GenerateFusionWorkbook.FUSION_INSPECTOR_LONG_NAME, FUSION_INSPECTOR_S1)
                .add(GenerateFusionWorkbook.FASTQC_LONG_NAME, FASTQC)
                .add(GenerateFusionWorkbook.PROJECT_NAME_LONG_NAME, "002_250101_PCAN")
                .addOutput(output));
        final Path workbook = workbookFile(output, "250101_PCAN");

        final List<String> fusions = column(workbook, FusionWorkbookWriter.SUMMARY_SHEET, FusionWorkbookWriter.IDENTITY_COLUMN);
        Assert.assertFalse(fusions.isEmpty());
        Assert.assertEquals(column(workbook, FusionWorkbookWriter.SUMMARY_SHEET, FusionWorkbookWriter.HISTORICAL_COUNT_COLUMN),
                Collections.nCopies(fusions.size(), "0"));
        Assert.assertEquals(column(workbook, FusionWorkbookWriter.SUMMARY_SHEET, FusionWorkbookWriter.KNOWN_COLUMN),
                Collections.nCopies(fusions.size(), "false"));
        Assert.assertEquals(column(workbook, FusionWorkbookWriter.SUMMARY_SHEET, FusionWorkbookWriter.PREVIOUSLY_REPORTED_COLUMN),
                Collections.nCopies(fusions.size(), "false"));
        Assert.assertTrue(column(workbook, FusionWorkbookWriter.PREVIOUS_RUNS_SHEET, HistoricalCallsLoader.COUNT_COLUMN).isEmpty());
    }

    @Test
    public void testBreakpointToleranceArgument() throws IOException {
        final File output = createTempDir("generateFusionWorkbook");
        runCommandLine(fixtureArguments(output)
                .add(GenerateFusionWorkbook.BREAKPOINT_TOLERANCE_LONG_NAME, 100)
                .addFlag(GenerateFusionWorkbook.ALLOW_EMPTY_SOURCES_LONG_NAME));
        Assert.assertEquals(column(workbookFile(output, "250101_PCAN"), FusionWorkbookWriter.SUMMARY_SHEET,
                FusionWorkbookWriter.IDENTITY_COLUMN).size(), 5);
    }

    @Test
    public void testProjectNameWithoutPrefix() {
        final File output = createTempDir("generateFusionWorkbook");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .add(GenerateFusionWorkbook.STAR_FUSION_LONG_NAME, STAR_FUSION_S1)
                .add(GenerateFusionWorkbook.FUSION_INSPECTOR_LONG_NAME, FUSION_INSPECTOR_S1)
                .add(GenerateFusionWorkbook.FASTQC_LONG_NAME, FASTQC)
                .add(GenerateFusionWorkbook.PREVIOUS_RUNS_LONG_NAME, PREVIOUS_RUNS)
                .add(GenerateFusionWorkbook.REFERENCE_SOURCES_LONG_NAME, REFERENCE_SOURCES)
                .add(GenerateFusionWorkbook.PREVIOUS_POSITIVES_LONG_NAME, PREVIOUS_POSITIVES)
                .add(GenerateFusionWorkbook.PROJECT_NAME_LONG_NAME, "PCAN")
                .addOutput(output);
        runCommandLine(args);
        Assert.assertTrue(Files.isRegularFile(workbookFile(output, "PCAN")));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testBlankProjectName() {
        final File output = createTempDir("generateFusionWorkbook");
        runCommandLine(fixtureArguments(output, " "));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testMissingRequiredArgument() {
        final File output = createTempDir("generateFusionWorkbook");
        runCommandLine(new ArgumentsBuilder()
                .add(GenerateFusionWorkbook.STAR_FUSION_LONG_NAME, STAR_FUSION_S1)
                .add(GenerateFusionWorkbook.PROJECT_NAME_LONG_NAME, "002_250101_PCAN")
                .addOutput(output));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingInputFile() {
        final File output = createTempDir("generateFusionWorkbook");
        runCommandLine(fixtureArguments(output)
                .add(GenerateFusionWorkbook.ARRIBA_LONG_NAME, Paths.get(fusionRunTestDir, "no_such_file.fusions.tsv")));
    }
}
