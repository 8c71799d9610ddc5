package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.io.IOUtils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;
import org.broadinstitute.fusionworkbook.utils.tsv.TableReaderOptions;
import org.broadinstitute.fusionworkbook.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the STAR-Fusion calls of earlier runs, {@code SF_Previous_Runs_<date>.tsv}.
 * <p>
 * The {@value #SAMPLES_ROW} row holds the number of samples rather than a fusion. When a gene pair appears on
 * more than one row, under either gene order, the largest count is kept. The count column may also be headed
 * {@value #RUN_COUNT_COLUMN}.
 * </p>
 */
public final class HistoricalCallsLoader {

    private static final Logger logger = LogManager.getLogger(HistoricalCallsLoader.class);

    public static final String FUSION_NAME_COLUMN = "#FusionName";
    public static final String COUNT_COLUMN = "Count_predicted";
    // header of the table as exported by the run pipeline
    public static final String RUN_COUNT_COLUMN = "Count_Run_1_Run_20_predicted";
    public static final String SAMPLES_ROW = "#Samples";

    public static final List<String> KEY_COLUMNS = ImmutableList.of(FUSION_NAME_COLUMN, COUNT_COLUMN);

    private final FusionIdentityNormalizer normalizer;

    public HistoricalCallsLoader(final FusionIdentityNormalizer normalizer) {
        this.normalizer = Utils.nonNull(normalizer);
    }

    public HistoricalCalls load(final Path file) {
        Utils.nonNull(file, "the file cannot be null");
        try (final Reader reader = IOUtils.makeReaderMaybeGzipped(file)) {
            return load(IOUtils.getFileName(file), reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    public HistoricalCalls load(final String sourceName, final Reader reader) throws IOException {
        final Map<FusionIdentity, HistoricalObservation> observations = new LinkedHashMap<>();
        Integer sampleCount = null;
        final ImmutableList.Builder<Map.Entry<String, Integer>> rows = ImmutableList.builder();
        final CountsReader tableReader = new CountsReader(sourceName, reader);
        for (final Map.Entry<String, Integer> row : tableReader) {
            rows.add(row);
            if (SAMPLES_ROW.equals(row.getKey())) {
                sampleCount = row.getValue();
                continue;
            }
            final FusionIdentity identity;
            try {
                identity = normalizer.normalizeName(row.getKey()).withoutBreakpoints();
            } catch (final UserException.MalformedFusionIdentity e) {
                logger.warn(String.format("Ignoring '%s' in %s: %s", row.getKey(), sourceName, e.getMessage()));
                continue;
            }
            observations.merge(identity, new HistoricalObservation(identity, row.getValue()),
                    (a, b) -> a.getCount() >= b.getCount() ? a : b);
        }
        final HistoricalCalls calls = new HistoricalCalls(ImmutableMap.copyOf(observations), sampleCount, rows.build());
        logger.info(String.format("Loaded %d historical fusions from %s (%s samples)",
                calls.size(), sourceName, sampleCount == null ? "unknown" : sampleCount));
        return calls;
    }

    /**
     * Reads name and count pairs; names are resolved by the caller since {@value #SAMPLES_ROW} is not a fusion.
     */
    private static final class CountsReader extends ReferenceTableReader<Map.Entry<String, Integer>> {

        CountsReader(final String sourceName, final Reader reader) throws IOException {
            super(sourceName, reader, TableReaderOptions.withoutComments(TableUtils.COLUMN_SEPARATOR)
                    .withHeaderAlias(RUN_COUNT_COLUMN, COUNT_COLUMN));
        }

        @Override
        protected List<String> keyColumns() {
            return KEY_COLUMNS;
        }

        @Override
        protected Map.Entry<String, Integer> parseRow(final DataLine dataLine) {
            final String name = dataLine.get(FUSION_NAME_COLUMN).trim();
            final int count = dataLine.getInt(COUNT_COLUMN);
            if (count < 0) {
                throw formatException("negative count for " + name);
            }
            return new AbstractMap.SimpleImmutableEntry<>(name, count);
        }
    }
}
