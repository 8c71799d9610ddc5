package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.QCMetric;
import org.broadinstitute.fusionworkbook.tools.fusion.SkippedRow;
import org.broadinstitute.fusionworkbook.tools.fusion.SpecimenNames;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.HistoricalCalls;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.List;
import java.util.Map;

/**
 * Everything produced by one run of {@link FusionWorkbookEngine}, ready to be rendered.
 */
public final class FusionWorkbook {

    private final String projectName;
    private final ImmutableMap<FusionSource, ImmutableList<FusionCall>> callsBySource;
    private final ImmutableList<QCMetric> qcMetrics;
    private final QCSummary qcSummary;
    private final ImmutableList<FusionRecord> records;
    private final ImmutableList<SummaryRow> summaryRows;
    private final ImmutableList<SkippedRow> skippedRows;
    private final HistoricalCalls historicalCalls;

    FusionWorkbook(final String projectName,
                   final Map<FusionSource, ImmutableList<FusionCall>> callsBySource,
                   final List<QCMetric> qcMetrics,
                   final List<FusionRecord> records,
                   final List<SummaryRow> summaryRows,
                   final List<SkippedRow> skippedRows,
                   final HistoricalCalls historicalCalls) {
        this.projectName = Utils.nonEmpty(projectName, "the project name cannot be empty");
        this.callsBySource = Maps.immutableEnumMap(callsBySource);
        this.qcMetrics = ImmutableList.copyOf(qcMetrics);
        this.qcSummary = QCSummary.of(qcMetrics);
        this.records = ImmutableList.copyOf(records);
        this.summaryRows = ImmutableList.copyOf(summaryRows);
        Utils.validateArg(records.size() == summaryRows.size(), "there must be one summary row per record");
        this.skippedRows = ImmutableList.copyOf(skippedRows);
        this.historicalCalls = Utils.nonNull(historicalCalls);
    }

    public String getProjectName() {
        return projectName;
    }

    /**
     * @see SpecimenNames#projectPrefixOf(String)
     */
    public String getProjectPrefix() {
        return SpecimenNames.projectPrefixOf(projectName);
    }

    /**
     * @return the calls of {@code source}, in file order then row order; empty if the source had no files.
     */
    public ImmutableList<FusionCall> getCalls(final FusionSource source) {
        return callsBySource.getOrDefault(Utils.nonNull(source), ImmutableList.of());
    }

    public ImmutableList<QCMetric> getQCMetrics() {
        return qcMetrics;
    }

    public QCSummary getQCSummary() {
        return qcSummary;
    }

    public ImmutableList<FusionRecord> getRecords() {
        return records;
    }

    public ImmutableList<SummaryRow> getSummaryRows() {
        return summaryRows;
    }

    public ImmutableList<SkippedRow> getSkippedRows() {
        return skippedRows;
    }

    public HistoricalCalls getHistoricalCalls() {
        return historicalCalls;
    }
}
