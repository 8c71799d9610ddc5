package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read-only lookup of fusions called in earlier runs, by gene pair.
 */
public final class HistoricalCalls {

    private static final HistoricalCalls EMPTY = new HistoricalCalls(ImmutableMap.of(), null);

    private final ImmutableMap<FusionIdentity, HistoricalObservation> observations;
    private final Integer sampleCount;
    private final ImmutableList<Map.Entry<String, Integer>> rows;

    /**
     * @param sampleCount number of samples the observations were collected from, {@code null} if unknown.
     */
    public HistoricalCalls(final ImmutableMap<FusionIdentity, HistoricalObservation> observations, final Integer sampleCount) {
        this(observations, sampleCount, ImmutableList.of());
    }

    /**
     * @param rows name and count of every usable row of the table the observations were loaded from, in file order.
     */
    public HistoricalCalls(final ImmutableMap<FusionIdentity, HistoricalObservation> observations, final Integer sampleCount,
                           final ImmutableList<Map.Entry<String, Integer>> rows) {
        this.observations = Utils.nonNull(observations);
        this.sampleCount = sampleCount;
        this.rows = Utils.nonNull(rows);
    }

    public static HistoricalCalls empty() {
        return EMPTY;
    }

    public Optional<HistoricalObservation> getObservation(final FusionIdentity identity) {
        return Optional.ofNullable(observations.get(Utils.nonNull(identity)));
    }

    /**
     * @return number of earlier calls of the identity's gene pair, 0 if never called.
     */
    public int getCount(final FusionIdentity identity) {
        return getObservation(identity).map(HistoricalObservation::getCount).orElse(0);
    }

    public OptionalInt getSampleCount() {
        return sampleCount == null ? OptionalInt.empty() : OptionalInt.of(sampleCount);
    }

    /**
     * @return the loaded table as written, sample count row included.
     */
    public ImmutableList<Map.Entry<String, Integer>> getRows() {
        return rows;
    }

    public int size() {
        return observations.size();
    }
}
