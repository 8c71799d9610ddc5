package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.ReferenceEntry;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything known about one fusion in this run: the calls of every source that reported its gene pair, and the
 * historical, curated and previously-reported annotations of the pair.
 * <p>
 * All the calls of a source are kept, ordered by file and line. Built by {@link FusionReconciler}.
 * </p>
 */
public final class FusionRecord {

    private final FusionIdentity identity;
    private final ImmutableListMultimap<FusionSource, FusionCall> callsBySource;
    private final int historicalCount;
    private final ImmutableList<ReferenceEntry> referenceHits;
    private final ImmutableSortedSet<String> previousPositiveSpecimens;
    private final boolean previousPositive;
    private final boolean breakpointConcordant;

    FusionRecord(final FusionIdentity identity,
                 final ImmutableListMultimap<FusionSource, FusionCall> callsBySource,
                 final int historicalCount,
                 final ImmutableList<ReferenceEntry> referenceHits,
                 final boolean previousPositive,
                 final ImmutableSortedSet<String> previousPositiveSpecimens,
                 final boolean breakpointConcordant) {
        this.identity = Utils.nonNull(identity);
        this.callsBySource = Utils.nonNull(callsBySource);
        Utils.validateArg(!callsBySource.isEmpty(), "a fusion record needs at least one call");
        Utils.validateArg(historicalCount >= 0, "the historical count cannot be negative");
        this.historicalCount = historicalCount;
        this.referenceHits = Utils.nonNull(referenceHits);
        this.previousPositive = previousPositive;
        this.previousPositiveSpecimens = Utils.nonNull(previousPositiveSpecimens);
        this.breakpointConcordant = breakpointConcordant;
    }

    /**
     * @return the gene pair of the record, without breakpoints.
     */
    public FusionIdentity getIdentity() {
        return identity;
    }

    /**
     * @return the sources that reported the fusion, highest priority first.
     */
    public ImmutableSet<FusionSource> getSources() {
        return callsBySource.keySet();
    }

    public boolean hasSource(final FusionSource source) {
        return callsBySource.containsKey(source);
    }

    public ImmutableList<FusionCall> getCalls(final FusionSource source) {
        return callsBySource.get(Utils.nonNull(source));
    }

    public ImmutableListMultimap<FusionSource, FusionCall> getCallsBySource() {
        return callsBySource;
    }

    /**
     * @return the call of the source with the strongest evidence, see {@link FusionCall#BEST_FIRST}.
     */
    public Optional<FusionCall> getBestCall(final FusionSource source) {
        return getCalls(source).stream().min(FusionCall.BEST_FIRST);
    }

    /**
     * @return the specimens of all calls, sorted.
     */
    public ImmutableSortedSet<String> getSpecimens() {
        return callsBySource.values().stream()
                .map(FusionCall::getSpecimen)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
    }

    /**
     * @return number of times the gene pair was called in earlier runs, 0 if never.
     */
    public int getHistoricalCount() {
        return historicalCount;
    }

    public ImmutableList<ReferenceEntry> getReferenceHits() {
        return referenceHits;
    }

    public boolean isPreviousPositive() {
        return previousPositive;
    }

    public ImmutableSortedSet<String> getPreviousPositiveSpecimens() {
        return previousPositiveSpecimens;
    }

    /**
     * @return whether every pair of calls agrees on the breakpoints within the tolerance. Informational only:
     * calls with discordant breakpoints still belong to the same record.
     */
    public boolean isBreakpointConcordant() {
        return breakpointConcordant;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FusionRecord that = (FusionRecord) o;
        return historicalCount == that.historicalCount
                && previousPositive == that.previousPositive
                && breakpointConcordant == that.breakpointConcordant
                && identity.equals(that.identity)
                && callsBySource.equals(that.callsBySource)
                && referenceHits.equals(that.referenceHits)
                && previousPositiveSpecimens.equals(that.previousPositiveSpecimens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, callsBySource, historicalCount, referenceHits, previousPositive);
    }

    @Override
    public String toString() {
        return "FusionRecord{" + identity.getName() +
                ", sources=" + getSources() +
                ", calls=" + callsBySource.size() +
                ", historicalCount=" + historicalCount +
                ", referenceHits=" + referenceHits +
                ", previousPositive=" + previousPositive +
                '}';
    }
}
