package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;

/**
 * A fusion called in earlier runs and the number of times it was called.
 */
public final class HistoricalObservation {

    private final FusionIdentity identity;
    private final int count;

    public HistoricalObservation(final FusionIdentity identity, final int count) {
        this.identity = Utils.nonNull(identity);
        Utils.validateArg(count >= 0, "the count cannot be negative");
        this.count = count;
    }

    public FusionIdentity getIdentity() {
        return identity;
    }

    public int getCount() {
        return count;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final HistoricalObservation that = (HistoricalObservation) o;
        return count == that.count && identity.equals(that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, count);
    }

    @Override
    public String toString() {
        return identity.getName() + "x" + count;
    }
}
