package org.broadinstitute.fusionworkbook.tools.fusion;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.*;

/**
 * One observation of a fusion in one row of one source file.
 * <p>
 * Evidence fields are optional since not every source reports all of them.
 * Instances are immutable and built with {@link Builder}.
 * </p>
 */
public final class FusionCall {

    /**
     * Orders calls from the strongest to the weakest evidence: junction reads, then spanning fragments, then FFPM,
     * all descending with missing values last. File name and line number break the remaining ties.
     */
    public static final Comparator<FusionCall> BEST_FIRST = Comparator
            .comparing((FusionCall c) -> c.junctionReadCount, FusionCall.<Integer>descendingMissingLast())
            .thenComparing((FusionCall c) -> c.spanningFragmentCount, FusionCall.<Integer>descendingMissingLast())
            .thenComparing((FusionCall c) -> c.ffpm, FusionCall.<Double>descendingMissingLast())
            .thenComparing(FusionCall::getFileName)
            .thenComparingLong(FusionCall::getLineNumber);

    /**
     * Input order: by file name, then line number.
     */
    public static final Comparator<FusionCall> BY_LOCATION = Comparator
            .comparing(FusionCall::getFileName)
            .thenComparingLong(FusionCall::getLineNumber);

    private final FusionIdentity identity;
    private final FusionSource source;
    private final String fileName;
    private final long lineNumber;
    private final String specimen;
    private final String displayName;
    private final Breakpoint leftBreakpoint;
    private final Breakpoint rightBreakpoint;
    private final Integer junctionReadCount;
    private final Integer spanningFragmentCount;
    private final Double ffpm;
    private final String spliceType;
    private final String frame;
    private final ImmutableMap<String, String> flags;

    private FusionCall(final Builder builder) {
        this.identity = Utils.nonNull(builder.identity, "the identity cannot be null");
        this.source = Utils.nonNull(builder.source, "the source cannot be null");
        this.fileName = Utils.nonNull(builder.fileName, "the file name cannot be null");
        this.lineNumber = builder.lineNumber;
        this.specimen = builder.specimen;
        this.displayName = builder.displayName != null ? builder.displayName : identity.getName();
        this.leftBreakpoint = builder.leftBreakpoint;
        this.rightBreakpoint = builder.rightBreakpoint;
        this.junctionReadCount = builder.junctionReadCount;
        this.spanningFragmentCount = builder.spanningFragmentCount;
        this.ffpm = builder.ffpm;
        this.spliceType = builder.spliceType;
        this.frame = builder.frame;
        this.flags = ImmutableMap.copyOf(builder.flags);
    }

    private static <T extends Comparable<T>> Comparator<T> descendingMissingLast() {
        return Comparator.nullsLast(Comparator.<T>reverseOrder());
    }

    public static Builder builder(final FusionIdentity identity, final FusionSource source) {
        return new Builder(identity, source);
    }

    public FusionIdentity getIdentity() {
        return identity;
    }

    public FusionSource getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * @return 1-based line of the row in its file.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    public Optional<String> getSpecimen() {
        return Optional.ofNullable(specimen);
    }

    /**
     * @return the fusion name as the tool wrote it, in the tool's gene order.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return breakpoint of the first gene of {@link #getDisplayName()}, empty if unknown.
     */
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

    /**
     * @return fusion fragments per million total reads.
     */
    public OptionalDouble getFFPM() {
        return ffpm == null ? OptionalDouble.empty() : OptionalDouble.of(ffpm);
    }

    public Optional<String> getSpliceType() {
        return Optional.ofNullable(spliceType);
    }

    /**
     * @return the reading frame of the fusion transcript, e.g. {@code INFRAME}.
     */
    public Optional<String> getFrame() {
        return Optional.ofNullable(frame);
    }

    /**
     * @return source-specific quality flags, e.g. Arriba's {@code confidence}.
     */
    public ImmutableMap<String, String> getFlags() {
        return flags;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final FusionCall that = (FusionCall) o;
        return lineNumber == that.lineNumber
                && identity.equals(that.identity)
                && source == that.source
                && fileName.equals(that.fileName)
                && Objects.equals(specimen, that.specimen)
                && displayName.equals(that.displayName)
                && Objects.equals(leftBreakpoint, that.leftBreakpoint)
                && Objects.equals(rightBreakpoint, that.rightBreakpoint)
                && Objects.equals(junctionReadCount, that.junctionReadCount)
                && Objects.equals(spanningFragmentCount, that.spanningFragmentCount)
                && Objects.equals(ffpm, that.ffpm)
                && Objects.equals(spliceType, that.spliceType)
                && Objects.equals(frame, that.frame)
                && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, source, fileName, lineNumber, junctionReadCount, spanningFragmentCount);
    }

    @Override
    public String toString() {
        return "FusionCall{" + source.getDisplayName() + " " + identity +
                " " + fileName + ":" + lineNumber +
                ", junction=" + junctionReadCount +
                ", spanning=" + spanningFragmentCount +
                ", ffpm=" + ffpm +
                '}';
    }

    /**
     * Builder for {@link FusionCall}. Only the identity and the source are required.
     */
    public static final class Builder {
        private final FusionIdentity identity;
        private final FusionSource source;
        private String fileName = "";
        private long lineNumber;
        private String specimen;
        private String displayName;
        private Breakpoint leftBreakpoint;
        private Breakpoint rightBreakpoint;
        private Integer junctionReadCount;
        private Integer spanningFragmentCount;
        private Double ffpm;
        private String spliceType;
        private String frame;
        private final Map<String, String> flags = new LinkedHashMap<>();

        private Builder(final FusionIdentity identity, final FusionSource source) {
            this.identity = Utils.nonNull(identity, "the identity cannot be null");
            this.source = Utils.nonNull(source, "the source cannot be null");
        }

        public Builder location(final String fileName, final long lineNumber) {
            this.fileName = Utils.nonNull(fileName);
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder specimen(final String specimen) {
            this.specimen = specimen;
            return this;
        }

        public Builder displayName(final String displayName) {
            this.displayName = displayName;
            return this;
        }

        /**
         * Sets the breakpoints in the order of the display name, either may be {@code null}.
         */
        public Builder breakpoints(final Breakpoint left, final Breakpoint right) {
            this.leftBreakpoint = left;
            this.rightBreakpoint = right;
            return this;
        }

        public Builder junctionReadCount(final int count) {
            Utils.validateArg(count >= 0, "the junction read count cannot be negative");
            this.junctionReadCount = count;
            return this;
        }

        public Builder spanningFragmentCount(final int count) {
            Utils.validateArg(count >= 0, "the spanning fragment count cannot be negative");
            this.spanningFragmentCount = count;
            return this;
        }

        public Builder ffpm(final double ffpm) {
            this.ffpm = ffpm;
            return this;
        }

        public Builder spliceType(final String spliceType) {
            this.spliceType = spliceType;
            return this;
        }

        public Builder frame(final String frame) {
            this.frame = frame;
            return this;
        }

        public Builder flag(final String name, final String value) {
            flags.put(Utils.nonNull(name), Utils.nonNull(value));
            return this;
        }

        public FusionCall build() {
            return new FusionCall(this);
        }
    }
}
