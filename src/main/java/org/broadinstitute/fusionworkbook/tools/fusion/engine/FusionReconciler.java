package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableListMultimap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.HistoricalCalls;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.PreviousPositives;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.ReferenceDatabase;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.*;

/**
 * Groups the calls of all sources by gene pair and annotates each group.
 * <p>
 * The gene pair alone decides the group: calls whose breakpoints disagree beyond the tolerance still join the
 * same record, which is then flagged as not breakpoint-concordant. Records are returned in order of first
 * appearance, visiting sources by precedence and each source's calls in list order. Record contents do not depend
 * on that order.
 * </p>
 */
public final class FusionReconciler {

    private static final Logger logger = LogManager.getLogger(FusionReconciler.class);

    private final FusionIdentityNormalizer normalizer;

    public FusionReconciler(final FusionIdentityNormalizer normalizer) {
        this.normalizer = Utils.nonNull(normalizer);
    }

    /**
     * @param callsBySource the calls of each source; a call filed under a source other than its own is rejected.
     * @param reference     curated fusions.
     * @param historical    calls of earlier runs.
     * @param positives     previously reported fusions.
     * @return one record per distinct gene pair.
     */
    public List<FusionRecord> reconcile(final Map<FusionSource, ? extends List<FusionCall>> callsBySource,
                                        final ReferenceDatabase reference,
                                        final HistoricalCalls historical,
                                        final PreviousPositives positives) {
        Utils.nonNull(callsBySource, "the calls cannot be null");
        Utils.nonNull(reference, "the reference database cannot be null");
        Utils.nonNull(historical, "the historical calls cannot be null");
        Utils.nonNull(positives, "the previous positives cannot be null");

        final Map<FusionIdentity, Map<FusionSource, List<FusionCall>>> groups = new LinkedHashMap<>();
        int callCount = 0;
        for (final FusionSource source : FusionSource.byPrecedence()) {
            final List<FusionCall> calls = callsBySource.get(source);
            if (calls == null) {
                continue;
            }
            for (final FusionCall call : calls) {
                Utils.nonNull(call, "calls cannot be null");
                Utils.validateArg(call.getSource() == source,
                        () -> "a " + call.getSource().getDisplayName() + " call was given as a " + source.getDisplayName() + " call: " + call);
                groups.computeIfAbsent(call.getIdentity().withoutBreakpoints(), k -> new EnumMap<>(FusionSource.class))
                        .computeIfAbsent(source, k -> new ArrayList<>())
                        .add(call);
                callCount++;
            }
        }

        final List<FusionRecord> records = new ArrayList<>(groups.size());
        for (final Map.Entry<FusionIdentity, Map<FusionSource, List<FusionCall>>> group : groups.entrySet()) {
            records.add(buildRecord(group.getKey(), group.getValue(), reference, historical, positives));
        }
        logger.info(String.format("Reconciled %d calls into %d fusions (%d recurrent, %d known, %d previously reported)",
                callCount, records.size(),
                records.stream().filter(r -> r.getHistoricalCount() > 0).count(),
                records.stream().filter(r -> !r.getReferenceHits().isEmpty()).count(),
                records.stream().filter(FusionRecord::isPreviousPositive).count()));
        return records;
    }

    private FusionRecord buildRecord(final FusionIdentity identity,
                                     final Map<FusionSource, List<FusionCall>> calls,
                                     final ReferenceDatabase reference,
                                     final HistoricalCalls historical,
                                     final PreviousPositives positives) {
        final ImmutableListMultimap.Builder<FusionSource, FusionCall> builder = ImmutableListMultimap.builder();
        final List<FusionCall> allCalls = new ArrayList<>();
        // EnumMap iterates in precedence order.
        for (final Map.Entry<FusionSource, List<FusionCall>> entry : calls.entrySet()) {
            final List<FusionCall> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(FusionCall.BY_LOCATION.thenComparing(FusionCall.BEST_FIRST));
            builder.putAll(entry.getKey(), sorted);
            allCalls.addAll(sorted);
        }
        return new FusionRecord(identity, builder.build(),
                historical.getCount(identity),
                reference.getHits(identity),
                positives.contains(identity),
                positives.getSpecimens(identity),
                isConcordant(allCalls));
    }

    private boolean isConcordant(final List<FusionCall> calls) {
        for (int i = 0; i < calls.size(); i++) {
            for (int j = i + 1; j < calls.size(); j++) {
                if (!normalizer.isSameFusion(calls.get(i).getIdentity(), calls.get(j).getIdentity())) {
                    return false;
                }
            }
        }
        return true;
    }
}
