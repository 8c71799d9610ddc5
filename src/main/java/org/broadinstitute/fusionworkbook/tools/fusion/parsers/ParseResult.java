package org.broadinstitute.fusionworkbook.tools.fusion.parsers;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.fusionworkbook.tools.fusion.SkippedRow;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.List;

/**
 * Output of a source parser: the records in input order and the rows that were skipped.
 *
 * @param <T> record type.
 */
public final class ParseResult<T> {

    private final ImmutableList<T> records;
    private final ImmutableList<SkippedRow> skippedRows;

    public ParseResult(final List<T> records, final List<SkippedRow> skippedRows) {
        this.records = ImmutableList.copyOf(Utils.nonNull(records));
        this.skippedRows = ImmutableList.copyOf(Utils.nonNull(skippedRows));
    }

    public static <T> ParseResult<T> empty() {
        return new ParseResult<>(ImmutableList.of(), ImmutableList.of());
    }

    public ImmutableList<T> getRecords() {
        return records;
    }

    public ImmutableList<SkippedRow> getSkippedRows() {
        return skippedRows;
    }

    /**
     * @return this result followed by {@code other}, for both records and skipped rows.
     */
    public ParseResult<T> concat(final ParseResult<T> other) {
        Utils.nonNull(other);
        return new ParseResult<>(
                ImmutableList.<T>builder().addAll(records).addAll(other.records).build(),
                ImmutableList.<SkippedRow>builder().addAll(skippedRows).addAll(other.skippedRows).build());
    }
}
