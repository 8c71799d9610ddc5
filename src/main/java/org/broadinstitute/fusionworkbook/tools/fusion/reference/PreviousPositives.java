package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.utils.Utils;

/**
 * Read-only set of fusions reported as positive in earlier cases, with the specimens that reported each one.
 */
public final class PreviousPositives {

    private static final PreviousPositives EMPTY = new PreviousPositives(ImmutableMap.of());

    private final ImmutableMap<FusionIdentity, ImmutableSortedSet<String>> specimensByFusion;

    public PreviousPositives(final ImmutableMap<FusionIdentity, ImmutableSortedSet<String>> specimensByFusion) {
        this.specimensByFusion = Utils.nonNull(specimensByFusion);
    }

    public static PreviousPositives empty() {
        return EMPTY;
    }

    public boolean contains(final FusionIdentity identity) {
        return specimensByFusion.containsKey(Utils.nonNull(identity));
    }

    /**
     * @return the specimens that reported the gene pair, sorted; empty if none.
     */
    public ImmutableSortedSet<String> getSpecimens(final FusionIdentity identity) {
        final ImmutableSortedSet<String> specimens = specimensByFusion.get(Utils.nonNull(identity));
        return specimens == null ? ImmutableSortedSet.of() : specimens;
    }

    public ImmutableSet<FusionIdentity> identities() {
        return specimensByFusion.keySet();
    }
}
