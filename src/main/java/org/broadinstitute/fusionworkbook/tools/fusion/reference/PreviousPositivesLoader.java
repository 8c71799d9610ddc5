package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.SortedSetMultimap;
import com.google.common.collect.TreeMultimap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentity;
import org.broadinstitute.fusionworkbook.tools.fusion.FusionIdentityNormalizer;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.io.IOUtils;
import org.broadinstitute.fusionworkbook.utils.tsv.DataLine;
import org.broadinstitute.fusionworkbook.utils.tsv.TableUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the list of previously reported positive results, a comma separated file with a specimen column and a
 * free text test result column.
 * <p>
 * Fusions are extracted from the free text as gene pairs joined by {@code ::}, {@code --} or a spaced
 * {@code " - "}. Pairs involving a transcript accession ({@code NM_}, {@code NR_}, {@code XM_}, {@code XR_},
 * {@code ENST}) are not fusions and are ignored.
 * </p>
 */
public final class PreviousPositivesLoader {

    private static final Logger logger = LogManager.getLogger(PreviousPositivesLoader.class);

    public static final String SPECIMEN_COLUMN = "Specimen Identifier";
    public static final String TEST_RESULT_COLUMN = "Test Result";

    public static final List<String> KEY_COLUMNS = ImmutableList.of(SPECIMEN_COLUMN, TEST_RESULT_COLUMN);

    private static final String GENE = "([A-Z0-9][A-Za-z0-9._]*(?:-[A-Za-z0-9._]+)*)";
    private static final Pattern FUSION_PATTERN = Pattern.compile(GENE + "(?:\\s*(?:::|--)\\s*|\\s+-\\s+)" + GENE);

    private static final List<String> TRANSCRIPT_PREFIXES = ImmutableList.of("NM_", "NR_", "XM_", "XR_", "ENST");

    private final FusionIdentityNormalizer normalizer;

    public PreviousPositivesLoader(final FusionIdentityNormalizer normalizer) {
        this.normalizer = Utils.nonNull(normalizer);
    }

    public PreviousPositives load(final Path file) {
        Utils.nonNull(file, "the file cannot be null");
        try (final Reader reader = IOUtils.makeReaderMaybeGzipped(file)) {
            return load(IOUtils.getFileName(file), reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    public PreviousPositives load(final String sourceName, final Reader reader) throws IOException {
        final SortedSetMultimap<FusionIdentity, String> specimens = TreeMultimap.create();
        final ResultsReader tableReader = new ResultsReader(sourceName, reader);
        for (final Map.Entry<String, List<FusionIdentity>> row : tableReader) {
            for (final FusionIdentity identity : row.getValue()) {
                specimens.put(identity, row.getKey());
            }
        }
        final ImmutableMap.Builder<FusionIdentity, ImmutableSortedSet<String>> builder = ImmutableMap.builder();
        for (final FusionIdentity identity : specimens.keySet()) {
            builder.put(identity, ImmutableSortedSet.copyOf(specimens.get(identity)));
        }
        final PreviousPositives positives = new PreviousPositives(builder.build());
        logger.info(String.format("Loaded %d previously reported fusions from %s", positives.identities().size(), sourceName));
        return positives;
    }

    /**
     * Extracts the fusions named in a free text test result, in order of appearance and without repeats.
     */
    @VisibleForTesting
    List<FusionIdentity> extractFusions(final String testResult) {
        final Set<FusionIdentity> fusions = new LinkedHashSet<>();
        final Matcher matcher = FUSION_PATTERN.matcher(Utils.nonNull(testResult));
        while (matcher.find()) {
            final String geneA = matcher.group(1);
            final String geneB = matcher.group(2);
            if (!isTranscript(geneA) && !isTranscript(geneB)) {
                fusions.add(normalizer.normalize(geneA, geneB));
            }
        }
        return new ArrayList<>(fusions);
    }

    private static boolean isTranscript(final String token) {
        return TRANSCRIPT_PREFIXES.stream().anyMatch(token::startsWith);
    }

    private final class ResultsReader extends ReferenceTableReader<Map.Entry<String, List<FusionIdentity>>> {

        ResultsReader(final String sourceName, final Reader reader) throws IOException {
            super(sourceName, reader, TableUtils.COMMA_SEPARATOR);
        }

        @Override
        protected List<String> keyColumns() {
            return KEY_COLUMNS;
        }

        @Override
        protected Map.Entry<String, List<FusionIdentity>> parseRow(final DataLine dataLine) {
            final String specimen = dataLine.get(SPECIMEN_COLUMN).trim();
            if (specimen.isEmpty()) {
                throw formatException("empty specimen identifier");
            }
            final List<FusionIdentity> fusions = extractFusions(dataLine.get(TEST_RESULT_COLUMN));
            return fusions.isEmpty() ? null : new AbstractMap.SimpleImmutableEntry<>(specimen, fusions);
        }
    }
}
