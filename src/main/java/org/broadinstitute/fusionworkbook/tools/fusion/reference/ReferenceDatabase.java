package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.stream.Collectors;

/**
 * Read-only lookup of curated fusions by gene pair.
 */
public final class ReferenceDatabase {

    private static final ReferenceDatabase EMPTY = new ReferenceDatabase(ImmutableListMultimap.of());

    private final ImmutableListMultimap<FusionIdentity, ReferenceEntry> entries;

    public ReferenceDatabase(final ImmutableListMultimap<FusionIdentity, ReferenceEntry> entries) {
        this.entries = Utils.nonNull(entries);
    }

    public static ReferenceDatabase empty() {
        return EMPTY;
    }

    /**
     * @return every entry for the identity's gene pair, in file order; empty if none.
     */
    public ImmutableList<ReferenceEntry> getHits(final FusionIdentity identity) {
        return entries.get(Utils.nonNull(identity));
    }

    /**
     * @return the distinct provenances of the hits, joined with commas.
     */
    public static String describe(final ImmutableList<ReferenceEntry> hits) {
        return hits.stream().map(ReferenceEntry::getProvenance).distinct().collect(Collectors.joining(","));
    }

    public int size() {
        return entries.size();
    }
}
