package org.broadinstitute.fusionworkbook.tools.fusion;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Comparator;
import java.util.Locale;

/**
 * Builds {@link FusionIdentity} keys from raw gene symbols and decides whether two identities are the same fusion.
 * <p>
 * Gene symbols are trimmed and upper-cased, then sorted so that {@code (A, B)} and {@code (B, A)} give the same
 * identity; breakpoints follow their genes. Two identities are the same fusion when their gene pairs are equal and,
 * for each partner whose breakpoint is known on both sides, the breakpoints are within the configured tolerance.
 * </p>
 */
public final class FusionIdentityNormalizer {

    /**
     * Separators accepted between the two gene symbols of a fusion name, tried in this order.
     */
    private static final String[] NAME_SEPARATORS = {FusionIdentity.NAME_SEPARATOR, "::"};

    // contigs compare by name
    private static final Comparator<Breakpoint> GENOMIC_ORDER = Comparator.nullsLast(
            Comparator.comparing(Breakpoint::getContig)
                    .thenComparingInt(Breakpoint::getPosition)
                    .thenComparing(bp -> bp.getStrand().orElse("")));

    private final int breakpointTolerance;

    /**
     * Creates a normalizer that requires exact breakpoint matches.
     */
    public FusionIdentityNormalizer() {
        this(0);
    }

    /**
     * @param breakpointTolerance maximum distance in bases between two compatible breakpoints.
     */
    public FusionIdentityNormalizer(final int breakpointTolerance) {
        Utils.validateArg(breakpointTolerance >= 0, "the breakpoint tolerance cannot be negative");
        this.breakpointTolerance = breakpointTolerance;
    }

    public int getBreakpointTolerance() {
        return breakpointTolerance;
    }

    /**
     * Normalizes a gene pair without breakpoints.
     */
    public FusionIdentity normalize(final String geneA, final String geneB) {
        return normalize(geneA, geneB, null, null);
    }

    /**
     * Normalizes a gene pair and its breakpoints.
     *
     * Both genes being the same, the breakpoints are put in genomic order, unknown last.
     *
     * @param breakpointA breakpoint of {@code geneA}, {@code null} if unknown.
     * @param breakpointB breakpoint of {@code geneB}, {@code null} if unknown.
     * @throws UserException.MalformedFusionIdentity if either gene symbol is {@code null} or blank.
     */
    public FusionIdentity normalize(final String geneA, final String geneB,
                                    final Breakpoint breakpointA, final Breakpoint breakpointB) {
        final String a = normalizeGene(geneA);
        final String b = normalizeGene(geneB);
        final int order = a.compareTo(b);
        if (order < 0 || (order == 0 && GENOMIC_ORDER.compare(breakpointA, breakpointB) <= 0)) {
            return new FusionIdentity(a, b, breakpointA, breakpointB);
        } else {
            return new FusionIdentity(b, a, breakpointB, breakpointA);
        }
    }

    /**
     * Normalizes a fusion name such as {@code EML4--ALK}, {@code EML4::ALK} or {@code EML4-ALK}.
     * <p>
     * A single {@code -} is only taken as the separator when it is the only one in the name, since gene symbols
     * such as {@code NKX2-1} contain dashes.
     * </p>
     *
     * @throws UserException.MalformedFusionIdentity if the name cannot be split into two gene symbols.
     */
    public FusionIdentity normalizeName(final String fusionName) {
        if (StringUtils.isBlank(fusionName)) {
            throw new UserException.MalformedFusionIdentity("the fusion name is empty");
        }
        for (final String separator : NAME_SEPARATORS) {
            final String[] genes = StringUtils.splitByWholeSeparatorPreserveAllTokens(fusionName, separator);
            if (genes.length == 2) {
                return normalize(genes[0], genes[1]);
            } else if (genes.length > 2) {
                throw new UserException.MalformedFusionIdentity("more than two genes in fusion name '" + fusionName + "'");
            }
        }
        if (StringUtils.countMatches(fusionName, '-') == 1) {
            final String[] genes = StringUtils.splitPreserveAllTokens(fusionName, '-');
            return normalize(genes[0], genes[1]);
        }
        throw new UserException.MalformedFusionIdentity("cannot find the two genes in fusion name '" + fusionName + "'");
    }

    /**
     * Checks whether two identities are the same fusion.
     * <p>
     * A breakpoint missing on either side is unknown and compatible with any breakpoint.
     * </p>
     */
    public boolean isSameFusion(final FusionIdentity first, final FusionIdentity second) {
        Utils.nonNull(first);
        Utils.nonNull(second);
        return first.equals(second)
                && compatible(first.getBreakpointA().orElse(null), second.getBreakpointA().orElse(null))
                && compatible(first.getBreakpointB().orElse(null), second.getBreakpointB().orElse(null));
    }

    private boolean compatible(final Breakpoint first, final Breakpoint second) {
        return first == null || second == null || first.isWithin(second, breakpointTolerance);
    }

    private static String normalizeGene(final String gene) {
        final String trimmed = StringUtils.trimToEmpty(gene);
        if (trimmed.isEmpty()) {
            throw new UserException.MalformedFusionIdentity("empty gene symbol");
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }
}
