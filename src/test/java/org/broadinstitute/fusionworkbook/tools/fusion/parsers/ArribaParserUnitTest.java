package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.Breakpoint;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Paths;

public final class ArribaParserUnitTest extends FusionWorkbookTestBase {

    private static final String HEADER = "#gene1\tgene2\tstrand1(gene/fusion)\tstrand2(gene/fusion)\tbreakpoint1\tbreakpoint2\ttype\t" +
            "split_reads1\tsplit_reads2\tdiscordant_mates\tconfidence\n";

    private static ParseResult<FusionCall> parse(final String content) throws IOException {
        return new ArribaParser(new FusionIdentityNormalizer(), false).parse("250101-S4-PCAN-R1.fusions.tsv", new StringReader(content));
    }

    @Test
    public void testFixture() {
        final ParseResult<FusionCall> result = new ArribaParser(new FusionIdentityNormalizer(), false).parse(Paths.get(ARRIBA_S1));
        Assert.assertEquals(result.getRecords().size(), 2);

        final FusionCall tmprss2Erg = result.getRecords().get(0);
        Assert.assertEquals(tmprss2Erg.getSource(), FusionSource.ARRIBA);
        Assert.assertEquals(tmprss2Erg.getDisplayName(), "TMPRSS2--ERG");
        Assert.assertEquals(tmprss2Erg.getIdentity().getName(), "ERG--TMPRSS2");
        Assert.assertEquals(tmprss2Erg.getJunctionReadCount().getAsInt(), 10);
        Assert.assertEquals(tmprss2Erg.getSpanningFragmentCount().getAsInt(), 3);
        Assert.assertFalse(tmprss2Erg.getFFPM().isPresent());
        Assert.assertEquals(tmprss2Erg.getLeftBreakpoint().get(), Breakpoint.parse("chr21:41508081:-"));
        Assert.assertEquals(tmprss2Erg.getRightBreakpoint().get(), Breakpoint.parse("chr21:38445621:-"));
        Assert.assertEquals(tmprss2Erg.getFrame().get(), "in-frame");
        Assert.assertEquals(tmprss2Erg.getFlags().get(ArribaParser.CONFIDENCE_COLUMN), "high");
        Assert.assertEquals(tmprss2Erg.getFlags().get(ArribaParser.TYPE_COLUMN), "deletion/read-through");
        Assert.assertEquals(tmprss2Erg.getSpecimen().get(), "S1");

        final FusionCall kif5bRet = result.getRecords().get(1);
        Assert.assertEquals(kif5bRet.getIdentity().getName(), "KIF5B--RET");
        Assert.assertEquals(kif5bRet.getJunctionReadCount().getAsInt(), 5);
        Assert.assertEquals(kif5bRet.getFlags().get(ArribaParser.CONFIDENCE_COLUMN), "medium");
    }

    @Test
    public void testGenesAreTrimmedAndStrandsOptional() throws IOException {
        final String content = HEADER +
                " KIF5B \tRET\t.\t+/.\tchr10:32017143\tchr10:43116584\tinversion\t3\t2\t1\tlow\n";
        final FusionCall call = parse(content).getRecords().get(0);
        Assert.assertEquals(call.getDisplayName(), "KIF5B--RET");
        Assert.assertFalse(call.getLeftBreakpoint().get().getStrand().isPresent());
        Assert.assertFalse(call.getRightBreakpoint().get().getStrand().isPresent());
        Assert.assertFalse(call.getFrame().isPresent());
    }

    @Test
    public void testBadRowsAreSkipped() throws IOException {
        final String content = HEADER +
                "TMPRSS2\tERG\t-/-\t-/-\tchr21:41508081\tchr21:38445621\tdeletion\t6\t4\t3\thigh\n" +
                "KIF5B\tRET\t-/-\t-/-\tchr10:32017143\tchr10:43116584\tinversion\tmany\t2\t1\tmedium\n" +
                "\tRET\t-/-\t-/-\tchr10:32017143\tchr10:43116584\tinversion\t1\t2\t1\tlow\n";
        final ParseResult<FusionCall> result = parse(content);
        Assert.assertEquals(result.getRecords().size(), 1);
        Assert.assertEquals(result.getSkippedRows().size(), 2);
        Assert.assertEquals(result.getSkippedRows().get(0).getSourceType(), "Arriba");
        Assert.assertEquals(result.getSkippedRows().get(1).getLineNumber(), 4);
    }

    @Test(expectedExceptions = UserException.SchemaViolation.class)
    public void testMissingDiscordantMates() throws IOException {
        parse("#gene1\tgene2\tbreakpoint1\tbreakpoint2\tsplit_reads1\tsplit_reads2\n" +
                "A\tB\tchr1:1\tchr1:2\t1\t1\n");
    }

    @DataProvider(name = "strands")
    public Object[][] strands() {
        return new Object[][]{
                {"+/-", "-"},
                {"-/+", "+"},
                {"+/.", null},
                {"-", "-"},
                {".", null},
                {null, null},
        };
    }

    @Test(dataProvider = "strands")
    public void testFusionStrand(final String strands, final String expected) {
        Assert.assertEquals(ArribaParser.fusionStrand(strands), expected);
    }
}
