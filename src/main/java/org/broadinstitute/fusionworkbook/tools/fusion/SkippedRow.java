package org.broadinstitute.fusionworkbook.tools.fusion;

import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.Objects;

/**
 * A row that was left out of a parser's output because it could not be parsed. Not an error: skipped rows are
 * logged and reported, and the run continues.
 */
public final class SkippedRow {

    private final String sourceType;
    private final String fileName;
    private final long lineNumber;
    private final String reason;

    /**
     * @param sourceType the kind of input, e.g. {@code STAR-Fusion}.
     * @param fileName   name of the file the row was read from.
     * @param lineNumber 1-based line of the row.
     * @param reason     why the row was skipped.
     */
    public SkippedRow(final String sourceType, final String fileName, final long lineNumber, final String reason) {
        this.sourceType = Utils.nonNull(sourceType);
        this.fileName = Utils.nonNull(fileName);
        this.lineNumber = lineNumber;
        this.reason = Utils.nonNull(reason);
    }

    public String getSourceType() {
        return sourceType;
    }

    public String getFileName() {
        return fileName;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SkippedRow that = (SkippedRow) o;
        return lineNumber == that.lineNumber && sourceType.equals(that.sourceType)
                && fileName.equals(that.fileName) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceType, fileName, lineNumber, reason);
    }

    @Override
    public String toString() {
        return sourceType + " " + fileName + ":" + lineNumber + " skipped: " + reason;
    }
}
