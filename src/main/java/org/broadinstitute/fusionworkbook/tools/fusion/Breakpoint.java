package org.broadinstitute.fusionworkbook.tools.fusion;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;
import java.util.Optional;

/**
 * A fusion partner's breakpoint: contig, 1-based position and, when known, strand.
 */
public final class Breakpoint implements Locatable {

    private static final String SEPARATOR = ":";

    private final String contig;
    private final int position;
    private final String strand;

    /**
     * @param contig   contig name, not blank.
     * @param position 1-based position.
     * @param strand   {@code "+"}, {@code "-"} or {@code null} if unknown.
     */
    public Breakpoint(final String contig, final int position, final String strand) {
        Utils.nonEmpty(contig, "the contig cannot be null or empty");
        Utils.validateArg(position > 0, () -> "position must be 1 or greater but was " + position);
        Utils.validateArg(strand == null || isStrand(strand), () -> "invalid strand: " + strand);
        this.contig = contig;
        this.position = position;
        this.strand = strand;
    }

    /**
     * Parses a breakpoint written as {@code contig:position[:strand]}, e.g. {@code chr2:29223528:-}.
     *
     * @throws UserException.BadInput if the text is not in that form.
     */
    public static Breakpoint parse(final String text) {
        Utils.nonNull(text, "the breakpoint text cannot be null");
        final String[] fields = text.trim().split(SEPARATOR);
        if (fields.length < 2 || fields.length > 3 || fields[0].isEmpty()) {
            throw new UserException.BadInput("invalid breakpoint '" + text + "': expected contig:position[:strand]");
        }
        final int position;
        try {
            position = Integer.parseInt(fields[1]);
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput("invalid breakpoint position in '" + text + "'", e);
        }
        if (position <= 0) {
            throw new UserException.BadInput("invalid breakpoint position in '" + text + "'");
        }
        final String strand = fields.length == 3 ? fields[2] : null;
        if (strand != null && !isStrand(strand)) {
            throw new UserException.BadInput("invalid breakpoint strand in '" + text + "'");
        }
        return new Breakpoint(fields[0], position, strand);
    }

    private static boolean isStrand(final String strand) {
        return "+".equals(strand) || "-".equals(strand);
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return position;
    }

    @Override
    public int getEnd() {
        return position;
    }

    public int getPosition() {
        return position;
    }

    public Optional<String> getStrand() {
        return Optional.ofNullable(strand);
    }

    /**
     * Returns a copy of this breakpoint with the given strand.
     */
    public Breakpoint withStrand(final String newStrand) {
        return new Breakpoint(contig, position, newStrand);
    }

    /**
     * Two breakpoints are within tolerance if they are on the same contig, their strands do not disagree
     * (an unknown strand agrees with any), and their positions differ by at most {@code tolerance} bases.
     */
    public boolean isWithin(final Breakpoint other, final int tolerance) {
        Utils.nonNull(other);
        Utils.validateArg(tolerance >= 0, "the tolerance cannot be negative");
        if (!contig.equals(other.contig)) {
            return false;
        }
        if (strand != null && other.strand != null && !strand.equals(other.strand)) {
            return false;
        }
        return Math.abs((long) position - other.position) <= tolerance;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Breakpoint that = (Breakpoint) o;
        return position == that.position && contig.equals(that.contig) && Objects.equals(strand, that.strand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contig, position, strand);
    }

    @Override
    public String toString() {
        return contig + SEPARATOR + position + (strand == null ? "" : SEPARATOR + strand);
    }
}
