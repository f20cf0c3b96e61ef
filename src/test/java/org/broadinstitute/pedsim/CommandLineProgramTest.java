package org.broadinstitute.pedsim;

import org.broadinstitute.pedsim.testutils.CommandLineProgramTester;

/**
 * Base of tests that run a program through {@link Main}; the program is named after the test class.
 */
public abstract class CommandLineProgramTest extends PedSimBaseTest implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
