package org.broadinstitute.fusionworkbook.tools.fusion;

import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class SpecimenNamesUnitTest extends FusionWorkbookTestBase {

    @DataProvider(name = "specimens")
    public Object[][] specimens() {
        return new Object[][]{
                {"250101-S1-PCAN-R1.star-fusion.fusion_predictions.abridged.tsv", "S1"},
                {"250101-S33-PCAN-R1_S33_L001_R1", "S33"},
                {"250101-S2", "S2"},
                {"250101", null},
                {"250101--PCAN", null},
                {"", null},
        };
    }

    @Test(dataProvider = "specimens")
    public void testSpecimenOf(final String name, final String expected) {
        Assert.assertEquals(SpecimenNames.specimenOf(name).orElse(null), expected);
    }

    @DataProvider(name = "igvNames")
    public Object[][] igvNames() {
        return new Object[][]{
                {"250101-S33-PCAN-R1_S33_L001_R1", "250101-S33-PCAN"},
                {"250101-S33", "250101-S33"},
        };
    }

    @Test(dataProvider = "igvNames")
    public void testIgvNameOf(final String name, final String expected) {
        Assert.assertEquals(SpecimenNames.igvNameOf(name), expected);
    }

    @DataProvider(name = "projectPrefixes")
    public Object[][] projectPrefixes() {
        return new Object[][]{
                {"002_250101_PCAN", "250101_PCAN"},
                {"PCAN", "PCAN"},
                {"PCAN_", "PCAN_"},
        };
    }

    @Test(dataProvider = "projectPrefixes")
    public void testProjectPrefixOf(final String projectName, final String expected) {
        Assert.assertEquals(SpecimenNames.projectPrefixOf(projectName), expected);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyProjectName() {
        SpecimenNames.projectPrefixOf("");
    }
}
