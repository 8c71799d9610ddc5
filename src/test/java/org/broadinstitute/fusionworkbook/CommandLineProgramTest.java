package org.broadinstitute.fusionworkbook;

import org.broadinstitute.fusionworkbook.testutils.CommandLineProgramTester;

/**
 * Utility class for CommandLine Program testing.
 */
public abstract class CommandLineProgramTest extends FusionWorkbookTestBase implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
