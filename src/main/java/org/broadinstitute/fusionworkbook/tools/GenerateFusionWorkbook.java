package org.broadinstitute.fusionworkbook.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.fusionworkbook.cmdline.CommandLineProgram;
import org.broadinstitute.fusionworkbook.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.fusionworkbook.cmdline.programgroups.FusionAnalysisProgramGroup;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.engine.FusionWorkbook;
import org.broadinstitute.fusionworkbook.tools.fusion.engine.FusionWorkbookEngine;
import org.broadinstitute.fusionworkbook.tools.fusion.engine.FusionWorkbookInputs;
import org.broadinstitute.fusionworkbook.tools.fusion.engine.FusionWorkbookWriter;
import org.broadinstitute.fusionworkbook.utils.config.ConfigFactory;
import org.broadinstitute.fusionworkbook.utils.config.FusionWorkbookConfig;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the gene-fusion calls of one sequencing run into a workbook.
 *
 * <h3>Inputs</h3>
 * <ul>
 *     <li>STAR-Fusion {@code star-fusion.fusion_predictions.abridged.tsv} files, one or more.</li>
 *     <li>FusionInspector {@code *.FusionInspector.fusions.abridged.merged.tsv} files, one or more.</li>
 *     <li>Arriba {@code fusions.tsv} files, optional.</li>
 *     <li>MultiQC {@code multiqc_fastqc.txt} files, one or more.</li>
 *     <li>Optionally, the STAR-Fusion calls of previous runs, the curated reference sources and the previously
 *     reported positives. A missing one annotates nothing.</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <p>
 * A {@code <project>_fusion_workbook.xlsx} Excel workbook with one sheet per table: the summary with one row per
 * fusion, the calls of each caller, the FastQC metrics and their per-specimen pivot, the calls of previous runs and
 * the rows that were skipped.
 * </p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * fusion-workbook GenerateFusionWorkbook \
 *   --star-fusion 250101-S1-PCAN-R1.star-fusion.fusion_predictions.abridged.tsv \
 *   --fusion-inspector 250101-S1-PCAN-R1.FusionInspector.fusions.abridged.merged.tsv \
 *   --arriba 250101-S1-PCAN-R1.fusions.tsv \
 *   --fastqc multiqc_fastqc.txt \
 *   --previous-runs SF_Previous_Runs.tsv \
 *   --reference-sources ReferenceSources.tsv \
 *   --previous-positives previous_positives.csv \
 *   --project-name 002_250101_PCAN \
 *   -O reports
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Aggregates the fusion calls of STAR-Fusion, FusionInspector and Arriba for one run, annotates them " +
                "with recurrence in previous runs, curated reference sources and previously reported positives, and " +
                "writes them with the FastQC metrics as an Excel workbook.",
        oneLineSummary = "Builds the fusion workbook of a sequencing run",
        programGroup = FusionAnalysisProgramGroup.class
)
public final class GenerateFusionWorkbook extends CommandLineProgram {

    public static final String STAR_FUSION_LONG_NAME = "star-fusion";
    public static final String FUSION_INSPECTOR_LONG_NAME = "fusion-inspector";
    public static final String ARRIBA_LONG_NAME = "arriba";
    public static final String FASTQC_LONG_NAME = "fastqc";
    public static final String PREVIOUS_RUNS_LONG_NAME = "previous-runs";
    public static final String REFERENCE_SOURCES_LONG_NAME = "reference-sources";
    public static final String PREVIOUS_POSITIVES_LONG_NAME = "previous-positives";
    public static final String PROJECT_NAME_LONG_NAME = "project-name";
    public static final String BREAKPOINT_TOLERANCE_LONG_NAME = "breakpoint-tolerance";
    public static final String ALLOW_EMPTY_SOURCES_LONG_NAME = "allow-empty-sources";

    @Argument(fullName = STAR_FUSION_LONG_NAME, doc = "STAR-Fusion abridged predictions.")
    public List<File> starFusionFiles = new ArrayList<>();

    @Argument(fullName = FUSION_INSPECTOR_LONG_NAME, doc = "FusionInspector abridged merged fusions.")
    public List<File> fusionInspectorFiles = new ArrayList<>();

    @Argument(fullName = ARRIBA_LONG_NAME, doc = "Arriba fusions.", optional = true)
    public List<File> arribaFiles = new ArrayList<>();

    @Argument(fullName = FASTQC_LONG_NAME, doc = "MultiQC FastQC general statistics.")
    public List<File> fastqcFiles = new ArrayList<>();

    @Argument(fullName = PREVIOUS_RUNS_LONG_NAME, doc = "STAR-Fusion call counts of previous runs.", optional = true)
    public File previousRunsFile;

    @Argument(fullName = REFERENCE_SOURCES_LONG_NAME, doc = "Curated fusions and the databases that list them.", optional = true)
    public File referenceSourcesFile;

    @Argument(fullName = PREVIOUS_POSITIVES_LONG_NAME, doc = "Comma separated export of previously reported test results.", optional = true)
    public File previousPositivesFile;

    @Argument(fullName = PROJECT_NAME_LONG_NAME, doc = "Name of the project, e.g. 002_250101_PCAN; its first field is dropped from the workbook name.")
    public String projectName;

    @Argument(shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            doc = "Directory in which the workbook file is written.")
    public File outputDirectory;

    @Argument(fullName = BREAKPOINT_TOLERANCE_LONG_NAME,
            doc = "Maximum distance in bases between two breakpoints of a fusion for them to agree.",
            optional = true, minValue = 0)
    public int breakpointTolerance = ConfigFactory.getInstance().getFusionWorkbookConfig().breakpoint_tolerance();

    @Argument(fullName = ALLOW_EMPTY_SOURCES_LONG_NAME,
            doc = "Accept input files with a header but no data rows.",
            optional = true)
    public boolean allowEmptySources = ConfigFactory.getInstance().getFusionWorkbookConfig().allow_empty_sources();

    private FusionWorkbookEngine engine;

    @Override
    protected String[] customCommandLineValidation() {
        if (projectName.trim().isEmpty()) {
            return new String[]{"--" + PROJECT_NAME_LONG_NAME + " cannot be blank"};
        }
        return null;
    }

    @Override
    protected void onStartup() {
        final FusionWorkbookConfig config = ConfigFactory.getInstance().getFusionWorkbookConfig();
        engine = new FusionWorkbookEngine(breakpointTolerance, allowEmptySources, config.fastqc_reads_scale());
        logger.info(String.format("Breakpoint tolerance: %d bp; empty sources %s",
                breakpointTolerance, allowEmptySources ? "allowed" : "not allowed"));
    }

    @Override
    protected Object doWork() {
        final FusionWorkbookInputs inputs = FusionWorkbookInputs.builder(projectName.trim())
                .callFiles(FusionSource.STAR_FUSION, toPaths(starFusionFiles))
                .callFiles(FusionSource.FUSION_INSPECTOR, toPaths(fusionInspectorFiles))
                .callFiles(FusionSource.ARRIBA, toPaths(arribaFiles))
                .qcFiles(toPaths(fastqcFiles))
                .historicalCalls(toPath(previousRunsFile))
                .referenceSources(toPath(referenceSourcesFile))
                .previousPositives(toPath(previousPositivesFile))
                .build();
        final FusionWorkbook workbook = engine.run(inputs);
        final Path workbookFile = new FusionWorkbookWriter(outputDirectory.toPath()).write(workbook);
        return workbookFile.toString();
    }

    private static Path toPath(final File file) {
        return file == null ? null : file.toPath();
    }

    private static List<Path> toPaths(final List<File> files) {
        return files.stream().map(File::toPath).collect(Collectors.toList());
    }
}
