package org.broadinstitute.tensorcaller;

import java.util.List;

/**
 * Utility class for command line program testing.
 */
public abstract class CommandLineProgramTest extends TensorCallerBaseTest {

    public Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(args.toArray(new String[0]));
    }

    public Object runCommandLine(final String... args) {
        return new Main().instanceMain(args);
    }
}
