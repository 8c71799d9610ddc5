package org.broadinstitute.fusionworkbook.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {
    private StandardArgumentDefinitions(){}

    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
    public static final String CONFIG_FILE_OPTION = "config-file";

    public static final String OUTPUT_SHORT_NAME = "O";
}
