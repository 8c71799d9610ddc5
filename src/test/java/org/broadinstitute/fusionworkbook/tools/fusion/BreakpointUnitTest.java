package org.broadinstitute.fusionworkbook.tools.fusion;

import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class BreakpointUnitTest extends FusionWorkbookTestBase {

    @DataProvider(name = "goodBreakpoints")
    public Object[][] goodBreakpoints() {
        return new Object[][]{
                {"chr2:29223528:-", "chr2", 29223528, "-"},
                {"chr21:41508081:+", "chr21", 41508081, "+"},
                {"chrX:100", "chrX", 100, null},
                {" chr1:5:+ ", "chr1", 5, "+"},
        };
    }

    @Test(dataProvider = "goodBreakpoints")
    public void testParse(final String text, final String contig, final int position, final String strand) {
        final Breakpoint breakpoint = Breakpoint.parse(text);
        Assert.assertEquals(breakpoint.getContig(), contig);
        Assert.assertEquals(breakpoint.getPosition(), position);
        Assert.assertEquals(breakpoint.getStart(), position);
        Assert.assertEquals(breakpoint.getEnd(), position);
        Assert.assertEquals(breakpoint.getStrand().orElse(null), strand);
        Assert.assertEquals(Breakpoint.parse(breakpoint.toString()), breakpoint);
    }

    @DataProvider(name = "badBreakpoints")
    public Object[][] badBreakpoints() {
        return new Object[][]{
                {""},
                {"chr1"},
                {":100"},
                {"chr1:abc"},
                {"chr1:0"},
                {"chr1:-5"},
                {"chr1:100:*"},
                {"chr1:100:+:extra"},
        };
    }

    @Test(dataProvider = "badBreakpoints", expectedExceptions = UserException.BadInput.class)
    public void testParseBadBreakpoint(final String text) {
        Breakpoint.parse(text);
    }

    @DataProvider(name = "within")
    public Object[][] within() {
        final Breakpoint plus = new Breakpoint("chr1", 1000, "+");
        return new Object[][]{
                {plus, new Breakpoint("chr1", 1000, "+"), 0, true},
                {plus, new Breakpoint("chr1", 1001, "+"), 0, false},
                {plus, new Breakpoint("chr1", 1005, "+"), 5, true},
                {plus, new Breakpoint("chr1", 994, "+"), 5, false},
                {plus, new Breakpoint("chr1", 1000, "-"), 10, false},
                {plus, new Breakpoint("chr1", 1000, null), 0, true},
                {plus, new Breakpoint("chr2", 1000, "+"), 10, false},
        };
    }

    @Test(dataProvider = "within")
    public void testIsWithin(final Breakpoint first, final Breakpoint second, final int tolerance, final boolean expected) {
        Assert.assertEquals(first.isWithin(second, tolerance), expected);
        Assert.assertEquals(second.isWithin(first, tolerance), expected);
    }

    @Test
    public void testWithStrand() {
        final Breakpoint breakpoint = new Breakpoint("chr10", 32017143, null);
        Assert.assertEquals(breakpoint.withStrand("-").toString(), "chr10:32017143:-");
        Assert.assertEquals(breakpoint.toString(), "chr10:32017143");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeToleranceIsRejected() {
        new Breakpoint("chr1", 10, "+").isWithin(new Breakpoint("chr1", 10, "+"), -1);
    }
}
