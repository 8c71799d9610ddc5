package org.broadinstitute.fusionworkbook.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that collect, reconcile and report gene-fusion calls.
 */
public final class FusionAnalysisProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "Fusion Analysis";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return "Tools that aggregate gene-fusion calls and QC metrics into a report"; }
}
