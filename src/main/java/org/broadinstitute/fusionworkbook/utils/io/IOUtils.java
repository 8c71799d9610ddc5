package org.broadinstitute.fusionworkbook.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

public final class IOUtils {

    private IOUtils() {}

    /**
     * Makes a reader for a file, unzipping if the file's name ends with '.gz'.
     */
    public static Reader makeReaderMaybeGzipped(final Path path) throws IOException {
        final InputStream in = new BufferedInputStream(Files.newInputStream(path));
        // toString because path.endsWith only checks whole path components, not substrings.
        return makeReaderMaybeGzipped(in, path.toString().endsWith(".gz"));
    }

    /**
     * makes a reader for an inputStream wrapping it in an appropriate unzipper if necessary
     * @param zipped is this stream zipped
     */
    public static Reader makeReaderMaybeGzipped(final InputStream in, final boolean zipped) throws IOException {
        if (zipped) {
            return new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8);
        } else {
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     */
    public static InputStream makeZippedInputStream(final InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * Opens a file for writing, creating any missing parent directory.
     */
    public static OutputStream makeOutputStream(final Path path) {
        Utils.nonNull(path, "the output path cannot be null");
        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new BufferedOutputStream(Files.newOutputStream(path));
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, "the file could not be opened for writing", e);
        }
    }

    /**
     * Returns the name of the file a path points to, without any directory component.
     */
    public static String getFileName(final Path path) {
        Utils.nonNull(path, "the path cannot be null");
        final Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }
}
