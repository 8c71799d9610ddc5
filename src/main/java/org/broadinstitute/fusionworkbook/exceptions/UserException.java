package org.broadinstitute.fusionworkbook.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed input files,
 * or input files whose layout does not match the one expected from the tool that produced them.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(final Path file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(final Path path, final Exception e) {
            this(path, getMessage(e), e);
        }

        public CouldNotReadInputFile(final String source, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", source, message), cause);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.toAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final Path file, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath(), message, getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message, final Throwable cause){
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(final String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * A column that the producing tool always writes is absent from an input or reference file.
     * <p>
     * Fatal for the whole run: a missing required field cannot be guessed.
     * </p>
     */
    public static class SchemaViolation extends UserException {
        private static final long serialVersionUID = 0L;

        private final String column;
        private final String source;

        public SchemaViolation(final String column, final String source) {
            super(String.format("Required column '%s' is missing from %s", column, source));
            this.column = column;
            this.source = source;
        }

        public String getColumn() {
            return column;
        }

        public String getSource() {
            return source;
        }
    }

    /**
     * A fusion identity could not be formed, typically because one of the gene symbols is blank.
     * <p>
     * Extends {@link BadInput} so that table readers treat it as a row-level problem.
     * </p>
     */
    public static class MalformedFusionIdentity extends BadInput {
        private static final long serialVersionUID = 0L;

        public MalformedFusionIdentity(final String message) {
            super(String.format("Cannot form a fusion identity: %s", message));
        }
    }

    /**
     * A source file produced no usable record.
     */
    public static class EmptyResult extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptyResult(final String source, final int skippedRows) {
            super(skippedRows == 0
                    ? String.format("No records found in %s", source)
                    : String.format("No usable records found in %s: all %d data rows were malformed", source, skippedRows));
        }
    }
}
