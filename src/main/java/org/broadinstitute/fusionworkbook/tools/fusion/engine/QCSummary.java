package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.fusionworkbook.tools.fusion.QCMetric;
import org.broadinstitute.fusionworkbook.tools.fusion.parsers.FastQCMetricsParser;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Unique and duplicate reads, in millions, summed per specimen over all its samples (read files and lanes).
 * Samples whose name carries no specimen are summed under the sample name.
 */
public final class QCSummary {

    public static final String TOTAL_LABEL = "Total";

    private final ImmutableList<Row> rows;
    private final Row total;

    private QCSummary(final List<Row> rows) {
        this.rows = ImmutableList.copyOf(rows);
        this.total = new Row(TOTAL_LABEL,
                rows.stream().mapToDouble(Row::getUniqueReadsM).sum(),
                rows.stream().mapToDouble(Row::getDuplicateReadsM).sum());
    }

    public static QCSummary of(final List<QCMetric> metrics) {
        Utils.nonNull(metrics, "the metrics cannot be null");
        final Map<String, double[]> sums = new TreeMap<>();
        for (final QCMetric metric : metrics) {
            final boolean unique = FastQCMetricsParser.UNIQUE_READS_M.equals(metric.getName());
            final boolean duplicate = FastQCMetricsParser.DUPLICATE_READS_M.equals(metric.getName());
            if ((!unique && !duplicate) || !metric.isNumeric()) {
                continue;
            }
            final double[] sum = sums.computeIfAbsent(metric.getSpecimen().orElse(metric.getSample()), k -> new double[2]);
            sum[unique ? 0 : 1] += metric.getNumericValue().getAsDouble();
        }
        final ImmutableList.Builder<Row> rows = ImmutableList.builder();
        sums.forEach((specimen, sum) -> rows.add(new Row(specimen, sum[0], sum[1])));
        return new QCSummary(rows.build());
    }

    /**
     * @return one row per specimen, sorted by specimen.
     */
    public ImmutableList<Row> getRows() {
        return rows;
    }

    public Row getTotal() {
        return total;
    }

    /**
     * @return the row of {@code specimen}, empty if no QC metric names it.
     */
    public Optional<Row> getRow(final String specimen) {
        Utils.nonNull(specimen);
        return rows.stream().filter(r -> r.getSpecimen().equals(specimen)).findFirst();
    }

    public static QCSummary empty() {
        return new QCSummary(ImmutableList.of());
    }

    public static final class Row {
        private final String specimen;
        private final double uniqueReadsM;
        private final double duplicateReadsM;

        Row(final String specimen, final double uniqueReadsM, final double duplicateReadsM) {
            this.specimen = Utils.nonNull(specimen);
            this.uniqueReadsM = uniqueReadsM;
            this.duplicateReadsM = duplicateReadsM;
        }

        public String getSpecimen() {
            return specimen;
        }

        public double getUniqueReadsM() {
            return uniqueReadsM;
        }

        public double getDuplicateReadsM() {
            return duplicateReadsM;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final Row row = (Row) o;
            return Double.compare(row.uniqueReadsM, uniqueReadsM) == 0
                    && Double.compare(row.duplicateReadsM, duplicateReadsM) == 0
                    && specimen.equals(row.specimen);
        }

        @Override
        public int hashCode() {
            return Objects.hash(specimen, uniqueReadsM, duplicateReadsM);
        }

        @Override
        public String toString() {
            return specimen + ": unique=" + uniqueReadsM + "M, duplicate=" + duplicateReadsM + "M";
        }
    }
}
