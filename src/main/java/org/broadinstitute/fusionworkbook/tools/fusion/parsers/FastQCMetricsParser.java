package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.fusionworkbook.tools.fusion.QCMetric;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses MultiQC {@code multiqc_fastqc.txt} tables into per-sample QC metrics.
 * <p>
 * Besides {@code Total Sequences}, each sample gets its unique and duplicate read counts, derived from
 * {@code total_deduplicated_percentage}, in reads and scaled to millions. Other non-empty columns are carried
 * over as categorical metrics.
 * </p>
 */
public final class FastQCMetricsParser implements SourceParser<QCMetric> {

    public static final String SOURCE_TYPE = "FastQC";

    public static final String SAMPLE_COLUMN = "Sample";
    public static final String TOTAL_SEQUENCES_COLUMN = "Total Sequences";
    public static final String DEDUPLICATED_PERCENTAGE_COLUMN = "total_deduplicated_percentage";

    public static final String TOTAL_SEQUENCES = "Total Sequences";
    public static final String UNIQUE_READS = "Unique Reads";
    public static final String DUPLICATE_READS = "Duplicate Reads";
    public static final String UNIQUE_READS_M = "Unique Reads(M)";
    public static final String DUPLICATE_READS_M = "Duplicate Reads(M)";

    public static final List<String> REQUIRED_COLUMNS = ImmutableList.of(
            SAMPLE_COLUMN, TOTAL_SEQUENCES_COLUMN, DEDUPLICATED_PERCENTAGE_COLUMN);

    public static final double DEFAULT_READS_SCALE = 1_000_000d;

    private final double readsScale;
    private final boolean allowEmpty;

    public FastQCMetricsParser(final boolean allowEmpty) {
        this(DEFAULT_READS_SCALE, allowEmpty);
    }

    /**
     * @param readsScale divisor used for the {@code (M)} metrics.
     */
    public FastQCMetricsParser(final double readsScale, final boolean allowEmpty) {
        Utils.validateArg(readsScale > 0, "the reads scale must be positive");
        this.readsScale = readsScale;
        this.allowEmpty = allowEmpty;
    }

    @Override
    public String getSourceType() {
        return SOURCE_TYPE;
    }

    @Override
    public ParseResult<QCMetric> parse(final String fileName, final Reader reader) throws IOException {
        final FastQCTableReader tableReader = new FastQCTableReader(fileName, reader);
        final ParseResult<List<QCMetric>> perSample = tableReader.readAll(allowEmpty);
        final List<QCMetric> metrics = new ArrayList<>();
        perSample.getRecords().forEach(metrics::addAll);
        return new ParseResult<>(metrics, perSample.getSkippedRows());
    }

    private final class FastQCTableReader extends SourceTableReader<List<QCMetric>> {

        FastQCTableReader(final String fileName, final Reader reader) throws IOException {
            super(SOURCE_TYPE, fileName, reader);
        }

        @Override
        protected List<String> requiredColumns() {
            return REQUIRED_COLUMNS;
        }

        @Override
        protected List<QCMetric> parseRow(final DataLine dataLine) {
            final String sample = requiredText(dataLine, SAMPLE_COLUMN);
            final double total = dataLine.getDouble(TOTAL_SEQUENCES_COLUMN);
            final double dedupPercentage = dataLine.getDouble(DEDUPLICATED_PERCENTAGE_COLUMN);
            if (total < 0 || dedupPercentage < 0 || dedupPercentage > 100) {
                throw formatException(String.format("out of range sequence count %s or deduplicated percentage %s", total, dedupPercentage));
            }
            final long totalReads = (long) Math.floor(total);
            final long uniqueReads = (long) Math.floor(dedupPercentage / 100 * totalReads);
            final long duplicateReads = totalReads - uniqueReads;

            final List<QCMetric> metrics = new ArrayList<>();
            metrics.add(QCMetric.numeric(sample, TOTAL_SEQUENCES, totalReads));
            metrics.add(QCMetric.numeric(sample, UNIQUE_READS, uniqueReads));
            metrics.add(QCMetric.numeric(sample, DUPLICATE_READS, duplicateReads));
            metrics.add(QCMetric.numeric(sample, UNIQUE_READS_M, uniqueReads / readsScale));
            metrics.add(QCMetric.numeric(sample, DUPLICATE_READS_M, duplicateReads / readsScale));
            for (final String column : dataLine.columns().names()) {
                if (!REQUIRED_COLUMNS.contains(column)) {
                    final String value = optionalText(dataLine, column);
                    if (value != null) {
                        metrics.add(QCMetric.categorical(sample, column, value));
                    }
                }
            }
            return metrics;
        }
    }
}
