package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.exceptions.FusionWorkbookException;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.QCMetric;
import org.broadinstitute.fusionworkbook.tools.fusion.SkippedRow;
import org.broadinstitute.fusionworkbook.tools.fusion.parsers.*;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.*;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.config.FusionWorkbookConfig;

import java.nio.file.Path;
import java.util.*;

/**
 * Runs the whole pipeline on local files: parse every source, load the lookups, reconcile and summarize.
 * <p>
 * Any schema violation, empty source or unreadable file propagates before reconciliation starts.
 * </p>
 */
public final class FusionWorkbookEngine {

    private static final Logger logger = LogManager.getLogger(FusionWorkbookEngine.class);

    private final FusionIdentityNormalizer normalizer;
    private final boolean allowEmptySources;
    private final double readsScale;

    /**
     * @param breakpointTolerance maximum distance in bases for two breakpoints to agree.
     * @param allowEmptySources   whether a source file without data rows is accepted.
     * @param readsScale          divisor of the {@code (M)} QC metrics.
     */
    public FusionWorkbookEngine(final int breakpointTolerance, final boolean allowEmptySources, final double readsScale) {
        this.normalizer = new FusionIdentityNormalizer(breakpointTolerance);
        this.allowEmptySources = allowEmptySources;
        Utils.validateArg(readsScale > 0, "the reads scale must be positive");
        this.readsScale = readsScale;
    }

    public FusionWorkbookEngine(final FusionWorkbookConfig config) {
        this(config.breakpoint_tolerance(), config.allow_empty_sources(), config.fastqc_reads_scale());
    }

    public FusionWorkbook run(final FusionWorkbookInputs inputs) {
        Utils.nonNull(inputs, "the inputs cannot be null");
        logger.info("Building the fusion workbook of project " + inputs.getProjectName());

        final List<SkippedRow> skippedRows = new ArrayList<>();
        final Map<FusionSource, ImmutableList<FusionCall>> callsBySource = new EnumMap<>(FusionSource.class);
        for (final FusionSource source : FusionSource.byPrecedence()) {
            final List<Path> files = inputs.getCallFiles(source);
            if (files.isEmpty()) {
                logger.info("No " + source.getDisplayName() + " files given");
                continue;
            }
            final ParseResult<FusionCall> result = parserFor(source).parse(files);
            callsBySource.put(source, result.getRecords());
            skippedRows.addAll(result.getSkippedRows());
        }
        final ParseResult<QCMetric> qc = new FastQCMetricsParser(readsScale, allowEmptySources).parse(inputs.getQCFiles());
        skippedRows.addAll(qc.getSkippedRows());

        final HistoricalCalls historical = inputs.getHistoricalCallsFile()
                .map(new HistoricalCallsLoader(normalizer)::load)
                .orElseGet(HistoricalCalls::empty);
        final ReferenceDatabase reference = inputs.getReferenceSourcesFile()
                .map(new ReferenceSourcesLoader(normalizer)::load)
                .orElseGet(ReferenceDatabase::empty);
        final PreviousPositives positives = inputs.getPreviousPositivesFile()
                .map(new PreviousPositivesLoader(normalizer)::load)
                .orElseGet(PreviousPositives::empty);

        final List<FusionRecord> records = new FusionReconciler(normalizer).reconcile(callsBySource, reference, historical, positives);
        final List<SummaryRow> summaryRows = new FusionSummaryBuilder(normalizer, QCSummary.of(qc.getRecords())).summarize(records);
        if (!skippedRows.isEmpty()) {
            logger.warn(String.format("%d rows were skipped across all inputs", skippedRows.size()));
        }
        return new FusionWorkbook(inputs.getProjectName(), callsBySource, qc.getRecords(), records, summaryRows,
                skippedRows, historical);
    }

    private SourceParser<FusionCall> parserFor(final FusionSource source) {
        switch (source) {
            case STAR_FUSION:
                return new StarFusionParser(normalizer, allowEmptySources);
            case FUSION_INSPECTOR:
                return new FusionInspectorParser(normalizer, allowEmptySources);
            case ARRIBA:
                return new ArribaParser(normalizer, allowEmptySources);
            default:
                throw new FusionWorkbookException.ShouldNeverReachHereException("Unknown fusion source: " + source);
        }
    }
}
