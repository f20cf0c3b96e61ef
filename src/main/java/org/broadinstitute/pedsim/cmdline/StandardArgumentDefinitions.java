package org.broadinstitute.pedsim.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String DEF_FILE_LONG_NAME = "def-file";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String PEDSIM_CONFIG_FILE_OPTION = "pedsim-config-file";

    public static final String DEF_FILE_SHORT_NAME = "d";

    public static final String QUIET_NAME = "QUIET";
}
