package org.broadinstitute.fusionworkbook.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

/**
 * Configuration file interface for the workbook engine.
 * <p>
 * Values are merged from, in order of precedence: the file named by the
 * {@value #CONFIG_FILE_VARIABLE_FILE_NAME} property, a {@code FusionWorkbookConfig.properties} file in the
 * working directory, the copy bundled on the class path, and the defaults below.
 * </p>
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + FusionWorkbookConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                 // Variable for file loading
        "file:FusionWorkbookConfig.properties",                                                  // Default path
        "classpath:org/broadinstitute/fusionworkbook/utils/config/FusionWorkbookConfig.properties" // Class path
})
public interface FusionWorkbookConfig extends Mutable, Accessible {

    /**
     * Name of the property that holds an optional path to a configuration file.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "FusionWorkbookConfig.pathToConfig";

    // ----------------------------------------------------------
    // Reconciliation Options:
    // ----------------------------------------------------------

    /**
     * Maximum distance in bases between two breakpoints on the same contig and strand for them to be the same.
     */
    @Key("breakpoint_tolerance")
    @DefaultValue("0")
    int breakpoint_tolerance();

    // ----------------------------------------------------------
    // Parsing Options:
    // ----------------------------------------------------------

    @Key("allow_empty_sources")
    @DefaultValue("false")
    boolean allow_empty_sources();

    /**
     * Divisor applied to read counts to obtain the "(M)" QC metrics.
     */
    @Key("fastqc_reads_scale")
    @DefaultValue("1000000")
    double fastqc_reads_scale();
}
