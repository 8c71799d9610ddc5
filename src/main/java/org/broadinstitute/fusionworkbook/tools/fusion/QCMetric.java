package org.broadinstitute.fusionworkbook.tools.fusion;

import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A run-level quality value for one sequenced sample: either numeric (e.g. {@code Total Sequences}) or
 * categorical (e.g. a pass/warn/fail module status).
 */
public final class QCMetric {

    private final String sample;
    private final String specimen;
    private final String name;
    private final Double numericValue;
    private final String categoricalValue;

    private QCMetric(final String sample, final String name, final Double numericValue, final String categoricalValue) {
        this.sample = Utils.nonEmpty(sample, "the sample cannot be empty");
        this.name = Utils.nonEmpty(name, "the metric name cannot be empty");
        this.specimen = SpecimenNames.specimenOf(sample).orElse(null);
        this.numericValue = numericValue;
        this.categoricalValue = categoricalValue;
    }

    public static QCMetric numeric(final String sample, final String name, final double value) {
        return new QCMetric(sample, name, value, null);
    }

    public static QCMetric categorical(final String sample, final String name, final String value) {
        return new QCMetric(sample, name, null, Utils.nonNull(value));
    }

    public String getSample() {
        return sample;
    }

    /**
     * @return the specimen the sample belongs to, see {@link SpecimenNames#specimenOf}.
     */
    public Optional<String> getSpecimen() {
        return Optional.ofNullable(specimen);
    }

    public String getName() {
        return name;
    }

    public boolean isNumeric() {
        return numericValue != null;
    }

    public OptionalDouble getNumericValue() {
        return numericValue == null ? OptionalDouble.empty() : OptionalDouble.of(numericValue);
    }

    /**
     * @return the value as text, whichever kind it is.
     */
    public String getValue() {
        if (numericValue == null) {
            return categoricalValue;
        }
        final double value = numericValue;
        return value == Math.rint(value) && !Double.isInfinite(value) ? Long.toString((long) value) : Double.toString(value);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final QCMetric that = (QCMetric) o;
        return sample.equals(that.sample) && name.equals(that.name)
                && Objects.equals(numericValue, that.numericValue)
                && Objects.equals(categoricalValue, that.categoricalValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sample, name, numericValue, categoricalValue);
    }

    @Override
    public String toString() {
        return sample + ":" + name + "=" + getValue();
    }
}
