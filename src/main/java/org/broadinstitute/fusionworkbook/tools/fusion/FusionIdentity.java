package org.broadinstitute.fusionworkbook.tools.fusion;

import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * Canonical key of a fusion: the gene pair in sorted order plus, when known, each partner's breakpoint.
 * <p>
 * Equality and hash code only consider the gene pair, so identities work as grouping keys regardless of breakpoints.
 * Breakpoint compatibility is checked with {@link FusionIdentityNormalizer#isSameFusion}.
 * Instances are created by {@link FusionIdentityNormalizer}.
 * </p>
 */
public final class FusionIdentity implements Comparable<FusionIdentity> {

    public static final String NAME_SEPARATOR = "--";

    private final String geneA;
    private final String geneB;
    private final Breakpoint breakpointA;
    private final Breakpoint breakpointB;

    /**
     * Genes must already be normalized and sorted; each breakpoint belongs to the gene in the same position.
     */
    FusionIdentity(final String geneA, final String geneB, final Breakpoint breakpointA, final Breakpoint breakpointB) {
        this.geneA = Utils.nonNull(geneA);
        this.geneB = Utils.nonNull(geneB);
        Utils.validateArg(geneA.compareTo(geneB) <= 0, "genes must be sorted");
        this.breakpointA = breakpointA;
        this.breakpointB = breakpointB;
    }

    /**
     * @return the lexicographically smaller gene symbol.
     */
    public String getGeneA() {
        return geneA;
    }

    public String getGeneB() {
        return geneB;
    }

    public Optional<Breakpoint> getBreakpointA() {
        return Optional.ofNullable(breakpointA);
    }

    public Optional<Breakpoint> getBreakpointB() {
        return Optional.ofNullable(breakpointB);
    }

    public boolean hasBreakpoints() {
        return breakpointA != null && breakpointB != null;
    }

    /**
     * @return the sorted pair joined with {@value #NAME_SEPARATOR}, e.g. {@code ALK--EML4}.
     */
    public String getName() {
        return geneA + NAME_SEPARATOR + geneB;
    }

    /**
     * Returns the identity of the same gene pair with no breakpoint data.
     */
    public FusionIdentity withoutBreakpoints() {
        return breakpointA == null && breakpointB == null ? this : new FusionIdentity(geneA, geneB, null, null);
    }

    @Override
    public int compareTo(final FusionIdentity other) {
        final int result = geneA.compareTo(other.geneA);
        return result != 0 ? result : geneB.compareTo(other.geneB);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FusionIdentity that = (FusionIdentity) o;
        return geneA.equals(that.geneA) && geneB.equals(that.geneB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(geneA, geneB);
    }

    @Override
    public String toString() {
        if (breakpointA == null && breakpointB == null) {
            return getName();
        }
        return getName() + "[" + (breakpointA == null ? "?" : breakpointA) + "," + (breakpointB == null ? "?" : breakpointB) + "]";
    }
}
