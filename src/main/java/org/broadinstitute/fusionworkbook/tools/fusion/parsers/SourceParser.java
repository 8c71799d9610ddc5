package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.Utils;
import org.broadinstitute.fusionworkbook.utils.io.IOUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.List;

/**
 * Turns the output of one tool into normalized records.
 * <p>
 * Each implementation owns its column mapping. Missing required columns raise
 * {@link UserException.SchemaViolation}; rows that cannot be parsed are reported as skipped rows; a file with no
 * usable rows raises {@link UserException.EmptyResult}.
 * </p>
 *
 * @param <T> record type, a fusion call or a QC metric.
 */
public interface SourceParser<T> {

    /**
     * @return the kind of input this parser reads, e.g. {@code STAR-Fusion}.
     */
    String getSourceType();

    /**
     * Parses a table read from {@code reader}.
     *
     * @param fileName name of the file being read, used for specimen names and messages.
     */
    ParseResult<T> parse(String fileName, Reader reader) throws IOException;

    /**
     * Parses one file, gzipped if its name ends with {@code .gz}.
     */
    default ParseResult<T> parse(final Path file) {
        Utils.nonNull(file, "the file cannot be null");
        try (final Reader reader = IOUtils.makeReaderMaybeGzipped(file)) {
            return parse(IOUtils.getFileName(file), reader);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(file, e);
        }
    }

    /**
     * Parses each file independently and concatenates the results in the order the files are given.
     * Duplicate fusions across files are kept.
     */
    default ParseResult<T> parse(final List<Path> files) {
        Utils.nonNull(files, "the file list cannot be null");
        ParseResult<T> result = ParseResult.empty();
        for (final Path file : files) {
            result = result.concat(parse(file));
        }
        return result;
    }
}
