package org.broadinstitute.fusionworkbook;

import org.broadinstitute.fusionworkbook.testutils.BaseTest;

import java.io.File;

/**
 * This is the base test class for all of our test cases.  All test cases should extend from this
 * class; it sets up the logger, and resolves the location of directories that we rely on.
 */
public abstract class FusionWorkbookTestBase extends BaseTest {

    private static final String CURRENT_DIRECTORY = System.getProperty("user.dir");
    public static final String projectDirectory = System.getProperty("fusionworkbookdir", CURRENT_DIRECTORY) + "/";

    private static final String publicTestDirRelative = "src/test/resources/";
    public static final String publicTestDir = new File(projectDirectory, publicTestDirRelative).getAbsolutePath() + "/";

    public static final String packageRootTestDir = publicTestDir + "org/broadinstitute/fusionworkbook/";
    public static final String toolsTestDir = packageRootTestDir + "tools/";

    /**
     * A small run: two specimens called by the three callers, with QC metrics and reference files.
     */
    public static final String fusionRunTestDir = toolsTestDir + "fusion/run/";

    public static final String STAR_FUSION_S1 = fusionRunTestDir + "250101-S1-PCAN-R1.star-fusion.fusion_predictions.abridged.tsv";
    public static final String STAR_FUSION_S2 = fusionRunTestDir + "250101-S2-PCAN-R1.star-fusion.fusion_predictions.abridged.tsv";
    public static final String FUSION_INSPECTOR_S1 = fusionRunTestDir + "250101-S1-PCAN-R1.FusionInspector.fusions.abridged.merged.tsv";
    public static final String ARRIBA_S1 = fusionRunTestDir + "250101-S1-PCAN-R1.fusions.tsv";
    public static final String FASTQC = fusionRunTestDir + "multiqc_fastqc.txt";
    public static final String PREVIOUS_RUNS = fusionRunTestDir + "SF_Previous_Runs.tsv";
    public static final String REFERENCE_SOURCES = fusionRunTestDir + "ReferenceSources.tsv";
    public static final String PREVIOUS_POSITIVES = fusionRunTestDir + "previous_positives.csv";
}
