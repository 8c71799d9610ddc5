package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.broadinstitute.fusionworkbook.tools.fusion.QCMetric;
import org.broadinstitute.fusionworkbook.tools.fusion.parsers.FastQCMetricsParser;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;

public final class QCSummaryUnitTest extends FusionWorkbookTestBase {

    @Test
    public void testSumsPerSpecimen() {
        final QCSummary summary = QCSummary.of(Arrays.asList(
                QCMetric.numeric("250101-S2-PCAN-R1_S2_L001_R1", FastQCMetricsParser.UNIQUE_READS_M, 1.0),
                QCMetric.numeric("250101-S1-PCAN-R1_S1_L001_R1", FastQCMetricsParser.UNIQUE_READS_M, 1.5),
                QCMetric.numeric("250101-S1-PCAN-R1_S1_L001_R2", FastQCMetricsParser.UNIQUE_READS_M, 0.25),
                QCMetric.numeric("250101-S1-PCAN-R1_S1_L001_R1", FastQCMetricsParser.DUPLICATE_READS_M, 0.5),
                QCMetric.numeric("250101-S1-PCAN-R1_S1_L001_R1", FastQCMetricsParser.TOTAL_SEQUENCES, 2000000),
                QCMetric.categorical("250101-S1-PCAN-R1_S1_L001_R1", "basic_statistics", "pass")));

        Assert.assertEquals(summary.getRows().stream().map(QCSummary.Row::getSpecimen).collect(Collectors.toList()),
                Arrays.asList("S1", "S2"));
        Assert.assertEquals(summary.getRows().get(0).getUniqueReadsM(), 1.75);
        Assert.assertEquals(summary.getRows().get(0).getDuplicateReadsM(), 0.5);
        Assert.assertEquals(summary.getRows().get(1).getUniqueReadsM(), 1.0);
        Assert.assertEquals(summary.getRows().get(1).getDuplicateReadsM(), 0.0);
        Assert.assertEquals(summary.getTotal().getSpecimen(), QCSummary.TOTAL_LABEL);
        Assert.assertEquals(summary.getTotal().getUniqueReadsM(), 2.75);
        Assert.assertEquals(summary.getTotal().getDuplicateReadsM(), 0.5);
    }

    @Test
    public void testSampleWithoutSpecimen() {
        final QCSummary summary = QCSummary.of(Collections.singletonList(
                QCMetric.numeric("undetermined", FastQCMetricsParser.UNIQUE_READS_M, 0.5)));
        Assert.assertEquals(summary.getRows().size(), 1);
        Assert.assertEquals(summary.getRows().get(0).getSpecimen(), "undetermined");
    }

    @Test
    public void testNoMetrics() {
        final QCSummary summary = QCSummary.of(Collections.emptyList());
        Assert.assertTrue(summary.getRows().isEmpty());
        Assert.assertEquals(summary.getTotal().getUniqueReadsM(), 0.0);
        Assert.assertEquals(summary.getTotal().getDuplicateReadsM(), 0.0);
    }

    @Test
    public void testFixture() {
        final QCSummary summary = QCSummary.of(new FastQCMetricsParser(false).parse(Paths.get(FASTQC)).getRecords());
        Assert.assertEquals(summary.getRows().size(), 2);
        Assert.assertEquals(summary.getRows().get(0).getUniqueReadsM(), 2.75, 1e-9);
        Assert.assertEquals(summary.getRows().get(0).getDuplicateReadsM(), 1.25, 1e-9);
        Assert.assertEquals(summary.getRows().get(1).getUniqueReadsM(), 0.5, 1e-9);
        Assert.assertEquals(summary.getTotal().getUniqueReadsM(), 3.25, 1e-9);
        Assert.assertEquals(summary.getTotal().getDuplicateReadsM(), 1.75, 1e-9);
    }
}
