package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.ReferenceDatabase;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Derives one {@link SummaryRow} per {@link FusionRecord}, in record order.
 * <p>
 * Each source is represented by one of its calls. The anchor is the best call of the highest priority source that
 * reported the fusion; every other source is represented by its best call whose breakpoints agree with the anchor's,
 * or by its best call if none agrees. A field then takes the value of the first representative, in
 * {@link FusionSource} precedence order, that has one. Breakpoints are taken as a pair from a single call.
 * </p>
 * <p>
 * Unique and duplicate reads are the {@link QCSummary} values of the record's specimens.
 * </p>
 */
public final class FusionSummaryBuilder {

    private final FusionIdentityNormalizer normalizer;
    private final QCSummary qcSummary;

    public FusionSummaryBuilder(final FusionIdentityNormalizer normalizer) {
        this(normalizer, QCSummary.empty());
    }

    /**
     * @param qcSummary read counts looked up by specimen for each row.
     */
    public FusionSummaryBuilder(final FusionIdentityNormalizer normalizer, final QCSummary qcSummary) {
        this.normalizer = Utils.nonNull(normalizer);
        this.qcSummary = Utils.nonNull(qcSummary);
    }

    public List<SummaryRow> summarize(final List<FusionRecord> records) {
        Utils.nonNull(records, "the records cannot be null");
        final List<SummaryRow> rows = new ArrayList<>(records.size());
        for (final FusionRecord record : records) {
            rows.add(summarize(record));
        }
        return rows;
    }

    public SummaryRow summarize(final FusionRecord record) {
        Utils.nonNull(record, "the record cannot be null");
        final List<FusionCall> representatives = representatives(record);
        final FusionCall anchor = representatives.get(0);

        final SummaryRow.Builder builder = SummaryRow.builder()
                .identityName(record.getIdentity().getName())
                .specimens(record.getSpecimens())
                .fusionName(anchor.getDisplayName(), anchor.getSource())
                .supportingSources(record.getSources())
                .historicalCount(record.getHistoricalCount())
                .referenceSources(ReferenceDatabase.describe(record.getReferenceHits()))
                .previousPositives(record.isPreviousPositive(), String.join(",", record.getPreviousPositiveSpecimens()));

        representatives.stream()
                .filter(c -> c.getLeftBreakpoint().isPresent() || c.getRightBreakpoint().isPresent())
                .findFirst()
                .ifPresent(c -> builder.breakpoints(c.getLeftBreakpoint().orElse(null), c.getRightBreakpoint().orElse(null), c.getSource()));
        resolve(representatives, c -> boxed(c.getJunctionReadCount()), builder::junctionReadCount);
        resolve(representatives, c -> boxed(c.getSpanningFragmentCount()), builder::spanningFragmentCount);
        resolve(representatives, c -> boxed(c.getFFPM()), builder::ffpm);
        resolve(representatives, FusionCall::getFrame, builder::frame);
        resolve(representatives, FusionCall::getSpliceType, builder::spliceType);
        addReadCounts(record, builder);
        return builder.build();
    }

    // summed over the specimens that have QC metrics; left empty when none has
    private void addReadCounts(final FusionRecord record, final SummaryRow.Builder builder) {
        final List<QCSummary.Row> qcRows = new ArrayList<>();
        for (final String specimen : record.getSpecimens()) {
            qcSummary.getRow(specimen).ifPresent(qcRows::add);
        }
        if (!qcRows.isEmpty()) {
            builder.readsM(qcRows.stream().mapToDouble(QCSummary.Row::getUniqueReadsM).sum(),
                    qcRows.stream().mapToDouble(QCSummary.Row::getDuplicateReadsM).sum());
        }
    }

    /**
     * @return one call per source of the record, anchor first, in precedence order.
     */
    private List<FusionCall> representatives(final FusionRecord record) {
        final List<FusionCall> representatives = new ArrayList<>();
        FusionCall anchor = null;
        for (final FusionSource source : record.getSources()) {
            final List<FusionCall> calls = new ArrayList<>(record.getCalls(source));
            calls.sort(FusionCall.BEST_FIRST);
            if (anchor == null) {
                anchor = calls.get(0);
                representatives.add(anchor);
                continue;
            }
            final FusionCall reference = anchor;
            representatives.add(calls.stream()
                    .filter(c -> normalizer.isSameFusion(reference.getIdentity(), c.getIdentity()))
                    .findFirst()
                    .orElse(calls.get(0)));
        }
        return representatives;
    }

    private static <T> void resolve(final List<FusionCall> representatives,
                                    final Function<FusionCall, Optional<T>> field,
                                    final BiConsumer<T, FusionSource> setter) {
        for (final FusionCall call : representatives) {
            final Optional<T> value = field.apply(call);
            if (value.isPresent()) {
                setter.accept(value.get(), call.getSource());
                return;
            }
        }
    }

    private static Optional<Integer> boxed(final OptionalInt value) {
        return value.isPresent() ? Optional.of(value.getAsInt()) : Optional.empty();
    }

    private static Optional<Double> boxed(final OptionalDouble value) {
        return value.isPresent() ? Optional.of(value.getAsDouble()) : Optional.empty();
    }
}
