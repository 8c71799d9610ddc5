package org.broadinstitute.fusionworkbook.tools.fusion.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.DataValidation;
import org.apache.poi.ss.usermodel.DataValidationHelper;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddressList;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionCall;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionSource;
import org.broadinstitute.fusionworkbook.tools.fusion.QCMetric;
import org.broadinstitute.fusionworkbook.tools.fusion.SkippedRow;
import org.broadinstitute.fusionworkbook.tools.fusion.SpecimenNames;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.HistoricalCallsLoader;
import org.broadinstitute.fusionworkbook.tools.fusion.reference.ReferenceDatabase;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.io.IOUtils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;
import org.broadinstitute.fusionworkbook.utils.tsv.TableColumnCollection;
import org.broadinstitute.fusionworkbook.utils.tsv.TableUtils;
import org.broadinstitute.fusionworkbook.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.*;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Renders a {@link FusionWorkbook} as the Excel workbook {@code <output>/<project>_fusion_workbook.xlsx}.
 * <p>
 * Sheets, in order: {@value #SUMMARY_SHEET}, one per fusion source in precedence order, {@value #FASTQC_SHEET},
 * {@value #FASTQC_PIVOT_SHEET}, {@value #PREVIOUS_RUNS_SHEET} and {@value #SKIPPED_ROWS_SHEET}. The review columns
 * of the summary are left blank with a drop-down of their allowed values.
 * </p>
 */
public final class FusionWorkbookWriter {

    private static final Logger logger = LogManager.getLogger(FusionWorkbookWriter.class);

    public static final String WORKBOOK_FILE_SUFFIX = "_fusion_workbook.xlsx";

    public static final String SUMMARY_SHEET = "Summary";
    public static final String FASTQC_SHEET = "FastQC";
    public static final String FASTQC_PIVOT_SHEET = "FastQC_Pivot";
    public static final String PREVIOUS_RUNS_SHEET = "PC1_PC20_Predicted";
    public static final String SKIPPED_ROWS_SHEET = "Skipped_Rows";

    // Summary sheet.
    public static final String FUSION_NAME_COLUMN = "FusionName";
    public static final String IDENTITY_COLUMN = "SortedFusionName";
    public static final String SPECIMENS_COLUMN = "Specimens";
    public static final String LEFT_BREAKPOINT_COLUMN = "LeftBreakpoint";
    public static final String RIGHT_BREAKPOINT_COLUMN = "RightBreakpoint";
    public static final String JUNCTION_READ_COUNT_COLUMN = "JunctionReadCount";
    public static final String SPANNING_FRAG_COUNT_COLUMN = "SpanningFragCount";
    public static final String FFPM_COLUMN = "FFPM";
    public static final String FRAME_COLUMN = "FRAME";
    public static final String SPLICE_TYPE_COLUMN = "SpliceType";
    public static final String VALUE_SOURCES_COLUMN = "ValueSources";
    public static final String SOURCES_COLUMN = "Sources";
    public static final String HISTORICAL_COUNT_COLUMN = "Count_predicted";
    public static final String RECURRENT_COLUMN = "Recurrent";
    public static final String KNOWN_COLUMN = "Known";
    public static final String REFERENCE_SOURCES_COLUMN = "ReferenceSources";
    public static final String PREVIOUSLY_REPORTED_COLUMN = "PreviouslyReported";
    public static final String PREVIOUS_POSITIVES_COLUMN = "PreviousPositives";
    public static final String REPORTED_COLUMN = "Reported";
    public static final String ONCOGENICITY_COLUMN = "Oncogenicity";

    public static final List<String> REPORTED_VALUES = ImmutableList.of("Yes", "No");
    public static final List<String> ONCOGENICITY_VALUES = ImmutableList.of(
            "Pathogenic", "Likely Pathogenic", "VUS", "Likely Benign", "Benign");

    // Call sheets.
    public static final String SPECIMEN_COLUMN = "Specimen";
    public static final String FILE_COLUMN = "File";
    public static final String LINE_COLUMN = "Line";
    public static final String IGV_NAME_COLUMN = "IGVName";

    // QC sheets.
    public static final String SAMPLE_COLUMN = "Sample";
    public static final String METRIC_COLUMN = "Metric";
    public static final String VALUE_COLUMN = "Value";
    public static final String UNIQUE_READS_M_COLUMN = "Unique Reads(M)";
    public static final String DUPLICATE_READS_M_COLUMN = "Duplicate Reads(M)";

    // Skipped rows sheet.
    public static final String SOURCE_TYPE_COLUMN = "Source";
    public static final String REASON_COLUMN = "Reason";

    public static final TableColumnCollection SUMMARY_COLUMNS = new TableColumnCollection(
            FUSION_NAME_COLUMN, IDENTITY_COLUMN, SPECIMENS_COLUMN, LEFT_BREAKPOINT_COLUMN, RIGHT_BREAKPOINT_COLUMN,
            JUNCTION_READ_COUNT_COLUMN, SPANNING_FRAG_COUNT_COLUMN, FFPM_COLUMN, FRAME_COLUMN, SPLICE_TYPE_COLUMN,
            SOURCES_COLUMN, VALUE_SOURCES_COLUMN, HISTORICAL_COUNT_COLUMN, RECURRENT_COLUMN, KNOWN_COLUMN,
            REFERENCE_SOURCES_COLUMN, PREVIOUSLY_REPORTED_COLUMN, PREVIOUS_POSITIVES_COLUMN,
            UNIQUE_READS_M_COLUMN, DUPLICATE_READS_M_COLUMN, REPORTED_COLUMN, ONCOGENICITY_COLUMN);

    public static final TableColumnCollection FASTQC_COLUMNS = new TableColumnCollection(
            SAMPLE_COLUMN, SPECIMEN_COLUMN, METRIC_COLUMN, VALUE_COLUMN);

    public static final TableColumnCollection FASTQC_PIVOT_COLUMNS = new TableColumnCollection(
            SPECIMEN_COLUMN, UNIQUE_READS_M_COLUMN, DUPLICATE_READS_M_COLUMN);

    public static final TableColumnCollection PREVIOUS_RUNS_COLUMNS = new TableColumnCollection(
            HistoricalCallsLoader.FUSION_NAME_COLUMN, HistoricalCallsLoader.COUNT_COLUMN);

    public static final TableColumnCollection SKIPPED_ROWS_COLUMNS = new TableColumnCollection(
            SOURCE_TYPE_COLUMN, FILE_COLUMN, LINE_COLUMN, REASON_COLUMN);

    /**
     * Columns written as numeric cells when their value is a number.
     */
    static final Set<String> NUMERIC_COLUMNS = ImmutableSet.of(JUNCTION_READ_COUNT_COLUMN, SPANNING_FRAG_COUNT_COLUMN,
            FFPM_COLUMN, HISTORICAL_COUNT_COLUMN, UNIQUE_READS_M_COLUMN, DUPLICATE_READS_M_COLUMN, VALUE_COLUMN,
            LINE_COLUMN);

    private static final String LIST_SEPARATOR = ",";

    private final Path outputDirectory;

    /**
     * @param outputDirectory directory in which the workbook file is created.
     */
    public FusionWorkbookWriter(final Path outputDirectory) {
        this.outputDirectory = Utils.nonNull(outputDirectory, "the output directory cannot be null");
    }

    /**
     * @return the file {@code workbook} is written to.
     */
    public Path getWorkbookFile(final FusionWorkbook workbook) {
        return outputDirectory.resolve(workbook.getProjectPrefix() + WORKBOOK_FILE_SUFFIX);
    }

    /**
     * Sheet name of the calls of a source, e.g. {@code Fusion_Inspector}.
     */
    public static String callSheetName(final FusionSource source) {
        switch (Utils.nonNull(source)) {
            case FUSION_INSPECTOR:
                return "Fusion_Inspector";
            default:
                return source.getDisplayName();
        }
    }

    /**
     * Writes the workbook, replacing an existing file.
     *
     * @return the workbook file.
     */
    public Path write(final FusionWorkbook workbook) {
        Utils.nonNull(workbook, "the workbook cannot be null");
        final Path file = getWorkbookFile(workbook);

        final Map<FusionIdentity, FusionRecord> recordsByIdentity = new HashMap<>();
        workbook.getRecords().forEach(r -> recordsByIdentity.put(r.getIdentity(), r));

        try (final XSSFWorkbook excel = new XSSFWorkbook()) {
            final Sheet summary = writeSheet(excel, SUMMARY_SHEET, SUMMARY_COLUMNS, workbook.getSummaryRows(), FusionWorkbookWriter::composeSummaryLine);
            addDropDown(summary, REPORTED_COLUMN, REPORTED_VALUES, workbook.getSummaryRows().size());
            addDropDown(summary, ONCOGENICITY_COLUMN, ONCOGENICITY_VALUES, workbook.getSummaryRows().size());
            for (final FusionSource source : FusionSource.byPrecedence()) {
                final ImmutableList<FusionCall> calls = workbook.getCalls(source);
                writeSheet(excel, callSheetName(source), callColumns(calls), calls,
                        (call, line) -> composeCallLine(call, recordsByIdentity.get(call.getIdentity()), line));
            }
            writeSheet(excel, FASTQC_SHEET, FASTQC_COLUMNS, workbook.getQCMetrics(), FusionWorkbookWriter::composeQCLine);
            final List<QCSummary.Row> pivot = new ArrayList<>(workbook.getQCSummary().getRows());
            pivot.add(workbook.getQCSummary().getTotal());
            writeSheet(excel, FASTQC_PIVOT_SHEET, FASTQC_PIVOT_COLUMNS, pivot, FusionWorkbookWriter::composePivotLine);
            writeSheet(excel, PREVIOUS_RUNS_SHEET, PREVIOUS_RUNS_COLUMNS, workbook.getHistoricalCalls().getRows(),
                    FusionWorkbookWriter::composePreviousRunLine);
            writeSheet(excel, SKIPPED_ROWS_SHEET, SKIPPED_ROWS_COLUMNS, workbook.getSkippedRows(), FusionWorkbookWriter::composeSkippedLine);

            try (final OutputStream out = IOUtils.makeOutputStream(file)) {
                excel.write(out);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(file, "the workbook could not be written", e);
        }

        workbook.getHistoricalCalls().getSampleCount().ifPresent(n ->
                logger.info(String.format("Recurrence counts are relative to %d previous samples", n)));
        logger.info(String.format("Wrote %d fusions to %s", workbook.getSummaryRows().size(), file.toAbsolutePath()));
        return file;
    }

    private static <R> Sheet writeSheet(final XSSFWorkbook excel, final String name, final TableColumnCollection columns,
                                        final List<R> records, final BiConsumer<R, DataLine> composer) {
        final Sheet sheet = excel.createSheet(name);
        try (final TableWriter<R> writer = TableUtils.writer(sheet, columns, NUMERIC_COLUMNS, composer)) {
            writer.writeAllRecords(records);
        }
        logger.debug(String.format("Wrote %d rows to sheet %s", records.size(), name));
        return sheet;
    }

    /**
     * Restricts the data cells of a column to a list of values. Covers at least one row so an empty sheet
     * still offers the list.
     */
    private static void addDropDown(final Sheet sheet, final String column, final List<String> values, final int rowCount) {
        final int index = SUMMARY_COLUMNS.indexOf(column);
        final DataValidationHelper helper = sheet.getDataValidationHelper();
        final DataValidation validation = helper.createValidation(
                helper.createExplicitListConstraint(values.toArray(new String[0])),
                new CellRangeAddressList(1, Math.max(1, rowCount), index, index));
        validation.setShowErrorBox(true);
        sheet.addValidationData(validation);
    }

    private static void composeSummaryLine(final SummaryRow row, final DataLine line) {
        line.set(FUSION_NAME_COLUMN, row.getFusionName())
                .set(IDENTITY_COLUMN, row.getIdentityName())
                .set(SPECIMENS_COLUMN, String.join(LIST_SEPARATOR, row.getSpecimens()))
                .set(LEFT_BREAKPOINT_COLUMN, text(row.getLeftBreakpoint()))
                .set(RIGHT_BREAKPOINT_COLUMN, text(row.getRightBreakpoint()))
                .set(JUNCTION_READ_COUNT_COLUMN, text(row.getJunctionReadCount()))
                .set(SPANNING_FRAG_COUNT_COLUMN, text(row.getSpanningFragmentCount()))
                .set(FFPM_COLUMN, text(row.getFFPM()))
                .set(FRAME_COLUMN, row.getFrame().orElse(""))
                .set(SPLICE_TYPE_COLUMN, row.getSpliceType().orElse(""))
                .set(SOURCES_COLUMN, row.getSupportingSources().stream().map(FusionSource::getDisplayName).collect(Collectors.joining(LIST_SEPARATOR)))
                .set(VALUE_SOURCES_COLUMN, row.getFieldSources().entrySet().stream()
                        .map(e -> e.getKey().name() + "=" + e.getValue().getDisplayName())
                        .collect(Collectors.joining(";")))
                .set(HISTORICAL_COUNT_COLUMN, row.getHistoricalCount())
                .set(RECURRENT_COLUMN, row.isRecurrent())
                .set(KNOWN_COLUMN, row.isKnown())
                .set(REFERENCE_SOURCES_COLUMN, row.getReferenceSources())
                .set(PREVIOUSLY_REPORTED_COLUMN, row.isPreviouslyReported())
                .set(PREVIOUS_POSITIVES_COLUMN, row.getPreviousPositives())
                .set(UNIQUE_READS_M_COLUMN, text(row.getUniqueReadsM()))
                .set(DUPLICATE_READS_M_COLUMN, text(row.getDuplicateReadsM()))
                .set(REPORTED_COLUMN, "")
                .set(ONCOGENICITY_COLUMN, "");
    }

    /**
     * Columns of a call sheet: the common call fields, the source-specific flags in order of first appearance,
     * then the annotations of the fusion and the origin of the row.
     */
    static TableColumnCollection callColumns(final List<FusionCall> calls) {
        final List<String> names = new ArrayList<>(Arrays.asList(FUSION_NAME_COLUMN, IDENTITY_COLUMN, SPECIMEN_COLUMN,
                LEFT_BREAKPOINT_COLUMN, RIGHT_BREAKPOINT_COLUMN, JUNCTION_READ_COUNT_COLUMN, SPANNING_FRAG_COUNT_COLUMN,
                FFPM_COLUMN, FRAME_COLUMN, SPLICE_TYPE_COLUMN));
        final Set<String> flags = new LinkedHashSet<>();
        calls.forEach(c -> flags.addAll(c.getFlags().keySet()));
        flags.stream().filter(f -> !names.contains(f)).forEach(names::add);
        names.addAll(Arrays.asList(HISTORICAL_COUNT_COLUMN, REFERENCE_SOURCES_COLUMN, PREVIOUS_POSITIVES_COLUMN,
                IGV_NAME_COLUMN, FILE_COLUMN, LINE_COLUMN));
        return new TableColumnCollection(names);
    }

    private static void composeCallLine(final FusionCall call, final FusionRecord record, final DataLine line) {
        line.set(FUSION_NAME_COLUMN, call.getDisplayName())
                .set(IDENTITY_COLUMN, call.getIdentity().getName())
                .set(SPECIMEN_COLUMN, call.getSpecimen().orElse(""))
                .set(LEFT_BREAKPOINT_COLUMN, text(call.getLeftBreakpoint()))
                .set(RIGHT_BREAKPOINT_COLUMN, text(call.getRightBreakpoint()))
                .set(JUNCTION_READ_COUNT_COLUMN, text(call.getJunctionReadCount()))
                .set(SPANNING_FRAG_COUNT_COLUMN, text(call.getSpanningFragmentCount()))
                .set(FFPM_COLUMN, text(call.getFFPM()))
                .set(FRAME_COLUMN, call.getFrame().orElse(""))
                .set(SPLICE_TYPE_COLUMN, call.getSpliceType().orElse(""))
                .set(HISTORICAL_COUNT_COLUMN, record == null ? 0 : record.getHistoricalCount())
                .set(REFERENCE_SOURCES_COLUMN, record == null ? "" : ReferenceDatabase.describe(record.getReferenceHits()))
                .set(PREVIOUS_POSITIVES_COLUMN, record == null ? "" : String.join(LIST_SEPARATOR, record.getPreviousPositiveSpecimens()))
                .set(IGV_NAME_COLUMN, SpecimenNames.igvNameOf(call.getFileName()))
                .set(FILE_COLUMN, call.getFileName())
                .set(LINE_COLUMN, call.getLineNumber());
        // Source-specific flags fill the remaining columns, blank when the call lacks them.
        final String[] values = line.toArray();
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                line.set(i, call.getFlags().getOrDefault(line.columns().nameAt(i), ""));
            }
        }
    }

    private static void composeQCLine(final QCMetric metric, final DataLine line) {
        line.set(SAMPLE_COLUMN, metric.getSample())
                .set(SPECIMEN_COLUMN, metric.getSpecimen().orElse(""))
                .set(METRIC_COLUMN, metric.getName())
                .set(VALUE_COLUMN, metric.getValue());
    }

    private static void composePivotLine(final QCSummary.Row row, final DataLine line) {
        line.set(SPECIMEN_COLUMN, row.getSpecimen())
                .set(UNIQUE_READS_M_COLUMN, row.getUniqueReadsM())
                .set(DUPLICATE_READS_M_COLUMN, row.getDuplicateReadsM());
    }

    private static void composePreviousRunLine(final Map.Entry<String, Integer> row, final DataLine line) {
        line.set(HistoricalCallsLoader.FUSION_NAME_COLUMN, row.getKey())
                .set(HistoricalCallsLoader.COUNT_COLUMN, row.getValue());
    }

    private static void composeSkippedLine(final SkippedRow row, final DataLine line) {
        line.set(SOURCE_TYPE_COLUMN, row.getSourceType())
                .set(FILE_COLUMN, row.getFileName())
                .set(LINE_COLUMN, row.getLineNumber())
                .set(REASON_COLUMN, row.getReason());
    }

    private static String text(final Optional<?> value) {
        return value.map(Object::toString).orElse("");
    }

    private static String text(final OptionalInt value) {
        return value.isPresent() ? Integer.toString(value.getAsInt()) : "";
    }

    private static String text(final OptionalDouble value) {
        return value.isPresent() ? Double.toString(value.getAsDouble()) : "";
    }
}
