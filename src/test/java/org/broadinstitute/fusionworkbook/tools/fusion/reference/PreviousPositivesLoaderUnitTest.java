package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import org.broadinstitute.fusionworkbook.FusionWorkbookTestBase;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class PreviousPositivesLoaderUnitTest extends FusionWorkbookTestBase {

    private final FusionIdentityNormalizer normalizer = new FusionIdentityNormalizer();

    @DataProvider(name = "testResults")
    public Object[][] testResults() {
        return new Object[][]{
                {"Positive for EML4::ALK fusion", Collections.singletonList("ALK--EML4")},
                {"BCR--ABL1 detected", Collections.singletonList("ABL1--BCR")},
                {"TMPRSS2 - ERG", Collections.singletonList("ERG--TMPRSS2")},
                {"EML4::ALK (NM_019063.5 - NM_004304.5)", Collections.singletonList("ALK--EML4")},
                {"ENST00000318522::ENST00000389048", Collections.emptyList()},
                {"NKX2-1::PAX8 and ETV6--NTRK3", Arrays.asList("NKX2-1--PAX8", "ETV6--NTRK3")},
                {"EML4::ALK, repeated: ALK::EML4", Collections.singletonList("ALK--EML4")},
                {"No fusion detected", Collections.emptyList()},
                {"TMPRSS2-ERG", Collections.emptyList()},
        };
    }

    @Test(dataProvider = "testResults")
    public void testExtractFusions(final String testResult, final List<String> expected) {
        final List<FusionIdentity> fusions = new PreviousPositivesLoader(normalizer).extractFusions(testResult);
        Assert.assertEquals(fusions.stream().map(FusionIdentity::getName).collect(Collectors.toList()), expected);
    }

    @Test
    public void testFixture() {
        final PreviousPositives positives = new PreviousPositivesLoader(normalizer).load(Paths.get(PREVIOUS_POSITIVES));
        Assert.assertEquals(positives.identities().size(), 3);
        Assert.assertTrue(positives.contains(normalizer.normalize("EML4", "ALK")));
        Assert.assertEquals(positives.getSpecimens(normalizer.normalize("EML4", "ALK")).asList(), Collections.singletonList("S0099"));
        Assert.assertEquals(positives.getSpecimens(normalizer.normalize("BCR", "ABL1")).asList(), Collections.singletonList("S0107"));
        Assert.assertTrue(positives.contains(normalizer.normalize("TMPRSS2", "ERG")));
        Assert.assertFalse(positives.contains(normalizer.normalize("KIF5B", "RET")));
        Assert.assertTrue(positives.getSpecimens(normalizer.normalize("KIF5B", "RET")).isEmpty());
    }

    @Test
    public void testSpecimensAreSortedAndUnique() throws IOException {
        final String content = "Specimen Identifier,Test Result\nS9,EML4::ALK\nS1,ALK--EML4\nS9,\"EML4::ALK, again\"\n";
        final PreviousPositives positives = new PreviousPositivesLoader(normalizer).load("positives.csv", new StringReader(content));
        Assert.assertEquals(positives.getSpecimens(normalizer.normalize("ALK", "EML4")).asList(), Arrays.asList("S1", "S9"));
    }

    @Test(expectedExceptions = UserException.SchemaViolation.class)
    public void testMissingTestResultColumn() throws IOException {
        new PreviousPositivesLoader(normalizer).load("positives.csv", new StringReader("Specimen Identifier,Result\nS1,EML4::ALK\n"));
    }
}
