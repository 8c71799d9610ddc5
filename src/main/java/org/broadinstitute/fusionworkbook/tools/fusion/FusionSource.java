package org.broadinstitute.fusionworkbook.tools.fusion;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The tools whose fusion calls are aggregated.
 * <p>
 * Declaration order is the precedence used when the same field is reported by more than one tool:
 * the primary caller wins over the validation tool, which wins over the secondary caller.
 * </p>
 */
public enum FusionSource {
    // primary caller
    STAR_FUSION("STAR-Fusion"),
    // validation tool
    FUSION_INSPECTOR("FusionInspector"),
    // secondary caller
    ARRIBA("Arriba");

    private static final List<FusionSource> PRECEDENCE = Collections.unmodifiableList(Arrays.asList(values()));

    private final String displayName;

    FusionSource(final String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return all sources, highest priority first.
     */
    public static List<FusionSource> byPrecedence() {
        return PRECEDENCE;
    }
}
