package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;

/**
 * Parses FusionInspector {@code FusionInspector.fusions.abridged.merged.tsv} files, which share the STAR-Fusion
 * columns. {@code PROT_FUSION_TYPE} holds the reading frame of the validated fusion.
 */
public final class FusionInspectorParser extends StarFusionParser {

    public FusionInspectorParser(final FusionIdentityNormalizer normalizer, final boolean allowEmpty) {
        super(FusionSource.FUSION_INSPECTOR, normalizer, allowEmpty);
    }
}
