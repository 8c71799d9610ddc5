package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import org.broadinstitute.fusionworkbook.tools.fusion.Breakpoint;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.*;

/**
 * The top-level view of one {@link FusionRecord}.
 * <p>
 * Fields that several sources can report are resolved by source precedence; {@link #getFieldSource(Field)} tells
 * which source supplied each of them. The read counts come from the FastQC metrics of the row's specimens.
 * Built by {@link FusionSummaryBuilder}.
 * </p>
 */
public final class SummaryRow {

    /**
     * The precedence-resolved fields.
     */
    public enum Field {
        FUSION_NAME,
        BREAKPOINTS,
        JUNCTION_READ_COUNT,
        SPANNING_FRAG_COUNT,
        FFPM,
        FRAME,
        SPLICE_TYPE
    }

    private final String fusionName;
    private final String identityName;
    private final ImmutableSortedSet<String> specimens;
    private final Breakpoint leftBreakpoint;
    private final Breakpoint rightBreakpoint;
    private final Integer junctionReadCount;
    private final Integer spanningFragmentCount;
    private final Double ffpm;
    private final String frame;
    private final String spliceType;
    private final ImmutableMap<Field, FusionSource> fieldSources;
    private final ImmutableSet<FusionSource> supportingSources;
    private final int historicalCount;
    private final String referenceSources;
    private final String previousPositives;
    private final boolean previouslyReported;
    private final Double uniqueReadsM;
    private final Double duplicateReadsM;

    private SummaryRow(final Builder builder) {
        this.fusionName = Utils.nonEmpty(builder.fusionName, "the fusion name cannot be empty");
        this.identityName = Utils.nonEmpty(builder.identityName, "the identity name cannot be empty");
        this.specimens = Utils.nonNull(builder.specimens);
        this.leftBreakpoint = builder.leftBreakpoint;
        this.rightBreakpoint = builder.rightBreakpoint;
        this.junctionReadCount = builder.junctionReadCount;
        this.spanningFragmentCount = builder.spanningFragmentCount;
        this.ffpm = builder.ffpm;
        this.frame = builder.frame;
        this.spliceType = builder.spliceType;
        this.fieldSources = Maps.immutableEnumMap(builder.fieldSources);
        this.supportingSources = Utils.nonEmpty(builder.supportingSources, "a summary row needs a supporting source");
        this.historicalCount = builder.historicalCount;
        this.referenceSources = Utils.nonNull(builder.referenceSources);
        this.previousPositives = Utils.nonNull(builder.previousPositives);
        this.previouslyReported = builder.previouslyReported;
        this.uniqueReadsM = builder.uniqueReadsM;
        this.duplicateReadsM = builder.duplicateReadsM;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * @return the fusion name as written by the source that supplied it, in caller orientation.
     */
    public String getFusionName() {
        return fusionName;
    }

    /**
     * @return the canonical, gene-sorted name, e.g. {@code GENE1--GENE2}.
     */
    public String getIdentityName() {
        return identityName;
    }

    public ImmutableSortedSet<String> getSpecimens() {
        return specimens;
    }

    public Optional<Breakpoint> getLeftBreakpoint() {
        return Optional.ofNullable(leftBreakpoint);
    }

    public Optional<Breakpoint> getRightBreakpoint() {
        return Optional.ofNullable(rightBreakpoint);
    }

    public OptionalInt getJunctionReadCount() {
        return junctionReadCount == null ? OptionalInt.empty() : OptionalInt.of(junctionReadCount);
    }

    public OptionalInt getSpanningFragmentCount() {
        return spanningFragmentCount == null ? OptionalInt.empty() : OptionalInt.of(spanningFragmentCount);
    }

    public OptionalDouble getFFPM() {
        return ffpm == null ? OptionalDouble.empty() : OptionalDouble.of(ffpm);
    }

    public Optional<String> getFrame() {
        return Optional.ofNullable(frame);
    }

    public Optional<String> getSpliceType() {
        return Optional.ofNullable(spliceType);
    }

    /**
     * @return unique reads in millions summed over the specimens of the row, empty if none has QC metrics.
     */
    public OptionalDouble getUniqueReadsM() {
        return uniqueReadsM == null ? OptionalDouble.empty() : OptionalDouble.of(uniqueReadsM);
    }

    public OptionalDouble getDuplicateReadsM() {
        return duplicateReadsM == null ? OptionalDouble.empty() : OptionalDouble.of(duplicateReadsM);
    }

    /**
     * @return the source the value of {@code field} was taken from, empty when no source reported it.
     */
    public Optional<FusionSource> getFieldSource(final Field field) {
        return Optional.ofNullable(fieldSources.get(Utils.nonNull(field)));
    }

    public ImmutableMap<Field, FusionSource> getFieldSources() {
        return fieldSources;
    }

    /**
     * @return every source that reported the fusion, highest priority first.
     */
    public ImmutableSet<FusionSource> getSupportingSources() {
        return supportingSources;
    }

    public int getHistoricalCount() {
        return historicalCount;
    }

    /**
     * @return comma separated provenances of the curated entries, empty if the fusion is not known.
     */
    public String getReferenceSources() {
        return referenceSources;
    }

    /**
     * @return comma separated specimens that previously reported the fusion, empty if none.
     */
    public String getPreviousPositives() {
        return previousPositives;
    }

    public boolean isRecurrent() {
        return historicalCount > 0;
    }

    public boolean isKnown() {
        return !referenceSources.isEmpty();
    }

    public boolean isPreviouslyReported() {
        return previouslyReported;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SummaryRow that = (SummaryRow) o;
        return historicalCount == that.historicalCount
                && previouslyReported == that.previouslyReported
                && fusionName.equals(that.fusionName)
                && identityName.equals(that.identityName)
                && specimens.equals(that.specimens)
                && Objects.equals(leftBreakpoint, that.leftBreakpoint)
                && Objects.equals(rightBreakpoint, that.rightBreakpoint)
                && Objects.equals(junctionReadCount, that.junctionReadCount)
                && Objects.equals(spanningFragmentCount, that.spanningFragmentCount)
                && Objects.equals(ffpm, that.ffpm)
                && Objects.equals(frame, that.frame)
                && Objects.equals(spliceType, that.spliceType)
                && fieldSources.equals(that.fieldSources)
                && supportingSources.equals(that.supportingSources)
                && referenceSources.equals(that.referenceSources)
                && previousPositives.equals(that.previousPositives)
                && Objects.equals(uniqueReadsM, that.uniqueReadsM)
                && Objects.equals(duplicateReadsM, that.duplicateReadsM);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fusionName, identityName, junctionReadCount, spanningFragmentCount, historicalCount);
    }

    @Override
    public String toString() {
        return "SummaryRow{" + fusionName +
                ", junctionReadCount=" + junctionReadCount +
                ", spanningFragmentCount=" + spanningFragmentCount +
                ", sources=" + supportingSources +
                ", recurrent=" + isRecurrent() +
                ", known=" + isKnown() +
                ", previouslyReported=" + previouslyReported +
                '}';
    }

    static final class Builder {
        private String fusionName;
        private String identityName;
        private ImmutableSortedSet<String> specimens = ImmutableSortedSet.of();
        private Breakpoint leftBreakpoint;
        private Breakpoint rightBreakpoint;
        private Integer junctionReadCount;
        private Integer spanningFragmentCount;
        private Double ffpm;
        private String frame;
        private String spliceType;
        private final EnumMap<Field, FusionSource> fieldSources = new EnumMap<>(Field.class);
        private ImmutableSet<FusionSource> supportingSources = ImmutableSet.of();
        private int historicalCount;
        private String referenceSources = "";
        private String previousPositives = "";
        private boolean previouslyReported;
        private Double uniqueReadsM;
        private Double duplicateReadsM;

        private Builder() {}

        Builder identityName(final String identityName) {
            this.identityName = identityName;
            return this;
        }

        Builder specimens(final ImmutableSortedSet<String> specimens) {
            this.specimens = specimens;
            return this;
        }

        Builder fusionName(final String fusionName, final FusionSource source) {
            this.fusionName = fusionName;
            return from(Field.FUSION_NAME, source);
        }

        Builder breakpoints(final Breakpoint left, final Breakpoint right, final FusionSource source) {
            this.leftBreakpoint = left;
            this.rightBreakpoint = right;
            return from(Field.BREAKPOINTS, source);
        }

        Builder junctionReadCount(final Integer count, final FusionSource source) {
            this.junctionReadCount = count;
            return from(Field.JUNCTION_READ_COUNT, source);
        }

        Builder spanningFragmentCount(final Integer count, final FusionSource source) {
            this.spanningFragmentCount = count;
            return from(Field.SPANNING_FRAG_COUNT, source);
        }

        Builder ffpm(final Double ffpm, final FusionSource source) {
            this.ffpm = ffpm;
            return from(Field.FFPM, source);
        }

        Builder frame(final String frame, final FusionSource source) {
            this.frame = frame;
            return from(Field.FRAME, source);
        }

        Builder spliceType(final String spliceType, final FusionSource source) {
            this.spliceType = spliceType;
            return from(Field.SPLICE_TYPE, source);
        }

        Builder supportingSources(final ImmutableSet<FusionSource> sources) {
            this.supportingSources = sources;
            return this;
        }

        Builder historicalCount(final int count) {
            this.historicalCount = count;
            return this;
        }

        Builder referenceSources(final String referenceSources) {
            this.referenceSources = referenceSources;
            return this;
        }

        Builder previousPositives(final boolean previouslyReported, final String specimens) {
            this.previouslyReported = previouslyReported;
            this.previousPositives = specimens;
            return this;
        }

        Builder readsM(final double unique, final double duplicate) {
            this.uniqueReadsM = unique;
            this.duplicateReadsM = duplicate;
            return this;
        }

        private Builder from(final Field field, final FusionSource source) {
            fieldSources.put(field, Utils.nonNull(source));
            return this;
        }

        SummaryRow build() {
            return new SummaryRow(this);
        }
    }
}
