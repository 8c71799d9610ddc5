package org.broadinstitute.fusionworkbook.tools.fusion.reference;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
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
import java.util.List;

/**
 * Loads the curated fusion database, {@code ReferenceSources.tsv}.
 * <p>
 * Each row names a fusion and lists, comma separated, the databases that document it.
 * </p>
 */
public final class ReferenceSourcesLoader {

    private static final Logger logger = LogManager.getLogger(ReferenceSourcesLoader.class);

    public static final String FUSION_COLUMN = "Fusion";
    public static final String REFERENCE_SOURCES_COLUMN = "ReferenceSources";
    public static final String ANNOTATION_COLUMN = "Annotation";

    public static final List<String> KEY_COLUMNS = ImmutableList.of(FUSION_COLUMN, REFERENCE_SOURCES_COLUMN);

    private final FusionIdentityNormalizer normalizer;

    public ReferenceSourcesLoader(final FusionIdentityNormalizer normalizer) {
        this.normalizer = Utils.nonNull(normalizer);
    }

    public ReferenceDatabase load(final Path file) {
        Utils.nonNull(file, "the file cannot be null");
        try (final Reader reader = IOUtils.makeReaderMaybeGzipped(file)) {
            return load(IOUtils.getFileName(file), reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    public ReferenceDatabase load(final String sourceName, final Reader reader) throws IOException {
        final ImmutableListMultimap.Builder<FusionIdentity, ReferenceEntry> builder = ImmutableListMultimap.builder();
        final EntriesReader tableReader = new EntriesReader(sourceName, reader);
        tableReader.forEach(entries -> entries.forEach(entry -> builder.put(entry.getIdentity(), entry)));
        final ReferenceDatabase database = new ReferenceDatabase(builder.build());
        logger.info(String.format("Loaded %d reference entries from %s (%d lines ignored)",
                database.size(), sourceName, tableReader.getIgnoredRows()));
        return database;
    }

    private final class EntriesReader extends ReferenceTableReader<List<ReferenceEntry>> {

        EntriesReader(final String sourceName, final Reader reader) throws IOException {
            super(sourceName, reader, TableUtils.COLUMN_SEPARATOR);
        }

        @Override
        protected List<String> keyColumns() {
            return KEY_COLUMNS;
        }

        @Override
        protected List<ReferenceEntry> parseRow(final DataLine dataLine) {
            final FusionIdentity identity = normalizer.normalizeName(dataLine.get(FUSION_COLUMN).trim()).withoutBreakpoints();
            final String annotation = dataLine.get(ANNOTATION_COLUMN, null);
            final ImmutableList.Builder<ReferenceEntry> entries = ImmutableList.builder();
            for (final String provenance : dataLine.get(REFERENCE_SOURCES_COLUMN).split(",")) {
                if (!provenance.trim().isEmpty()) {
                    entries.add(new ReferenceEntry(identity, provenance.trim(), annotation == null ? null : annotation.trim()));
                }
            }
            final List<ReferenceEntry> result = entries.build();
            if (result.isEmpty()) {
                throw formatException("no reference source for " + identity.getName());
            }
            return result;
        }
    }
}
