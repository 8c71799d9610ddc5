package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Paths;

public final class FusionInspectorParserUnitTest extends FusionWorkbookTestBase {

    @Test
    public void testFixture() {
        final FusionInspectorParser parser = new FusionInspectorParser(new FusionIdentityNormalizer(), false);
        Assert.assertEquals(parser.getSourceType(), "FusionInspector");
        final ParseResult<FusionCall> result = parser.parse(Paths.get(FUSION_INSPECTOR_S1));
        Assert.assertEquals(result.getRecords().size(), 2);

        final FusionCall tmprss2Erg = result.getRecords().get(0);
        Assert.assertEquals(tmprss2Erg.getSource(), FusionSource.FUSION_INSPECTOR);
        Assert.assertEquals(tmprss2Erg.getFrame().get(), "INFRAME");
        Assert.assertEquals(tmprss2Erg.getJunctionReadCount().getAsInt(), 10);
        Assert.assertEquals(tmprss2Erg.getFFPM().getAsDouble(), 2.9, 1e-9);

        final FusionCall alkEml4 = result.getRecords().get(1);
        Assert.assertEquals(alkEml4.getDisplayName(), "ALK--EML4");
        Assert.assertEquals(alkEml4.getIdentity().getName(), "ALK--EML4");
        Assert.assertEquals(alkEml4.getFrame().get(), "FRAMESHIFT");
        Assert.assertEquals(alkEml4.getLeftBreakpoint().get().toString(), "chr2:29223584:-");
        Assert.assertEquals(alkEml4.getSpecimen().get(), "S1");
    }

    @Test
    public void testMissingFrameIsEmpty() throws IOException {
        final String content = "#FusionName\tJunctionReadCount\tSpanningFragCount\tLeftBreakpoint\tRightBreakpoint\tPROT_FUSION_TYPE\n" +
                "A--B\t1\t0\tchr1:100:+\tchr2:200:-\t.\n";
        final ParseResult<FusionCall> result = new FusionInspectorParser(new FusionIdentityNormalizer(), false)
                .parse("250101-S3-PCAN-R1.FusionInspector.fusions.abridged.merged.tsv", new StringReader(content));
        Assert.assertFalse(result.getRecords().get(0).getFrame().isPresent());
        Assert.assertEquals(result.getRecords().get(0).getSpecimen().get(), "S3");
    }

    @Test(expectedExceptions = UserException.SchemaViolation.class)
    public void testMissingBreakpointColumn() throws IOException {
        final String content = "#FusionName\tJunctionReadCount\tSpanningFragCount\tLeftBreakpoint\n" +
                "A--B\t1\t0\tchr1:100:+\n";
        new FusionInspectorParser(new FusionIdentityNormalizer(), false).parse("fi.tsv", new StringReader(content));
    }
}
