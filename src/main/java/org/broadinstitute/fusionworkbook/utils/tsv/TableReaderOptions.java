package org.broadinstitute.fusionworkbook.utils.tsv;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.fusionworkbook.utils.Utils;

/**
 * Layout choices for a {@link TableReader}: the column separator, the comment line prefix and alternative
 * header names.
 */
public final class TableReaderOptions {

    final char columnSeparator;

    /**
     * {@code null} when the input has no comment lines at all.
     */
    final String commentPrefix;

    /**
     * Header names replaced by their canonical column name when the header line is read.
     */
    final ImmutableMap<String, String> headerAliases;

    public TableReaderOptions() {
        this(TableUtils.COLUMN_SEPARATOR, TableUtils.COMMENT_PREFIX);
    }

    public TableReaderOptions(final char columnSeparator, final String commentPrefix) {
        this(columnSeparator, commentPrefix, ImmutableMap.of());
    }

    private TableReaderOptions(final char columnSeparator, final String commentPrefix,
                               final ImmutableMap<String, String> headerAliases) {
        this.columnSeparator = columnSeparator;
        this.commentPrefix = commentPrefix;
        this.headerAliases = headerAliases;
    }

    /**
     * Options for inputs whose header line itself may start with {@link TableUtils#COMMENT_PREFIX}
     * (e.g. {@code #FusionName}) and that therefore cannot have comment lines.
     */
    public static TableReaderOptions withoutComments(final char columnSeparator) {
        return new TableReaderOptions(columnSeparator, null);
    }

    /**
     * @return a copy of these options under which a header called {@code alias} is read as column {@code name}.
     * @throws IllegalArgumentException if {@code alias} already has a different name.
     */
    public TableReaderOptions withHeaderAlias(final String alias, final String name) {
        Utils.nonEmpty(alias, "the alias cannot be empty");
        Utils.nonEmpty(name, "the column name cannot be empty");
        Utils.validateArg(name.equals(headerAliases.getOrDefault(alias, name)), () -> "conflicting names for alias " + alias);
        final ImmutableMap.Builder<String, String> aliases = ImmutableMap.builder();
        headerAliases.forEach((a, n) -> {
            if (!a.equals(alias)) {
                aliases.put(a, n);
            }
        });
        return new TableReaderOptions(columnSeparator, commentPrefix, aliases.put(alias, name).build());
    }
}
