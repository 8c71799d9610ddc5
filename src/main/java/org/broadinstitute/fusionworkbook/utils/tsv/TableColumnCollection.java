package org.broadinstitute.fusionworkbook.utils.tsv;

import org.broadinstitute.fusionworkbook.utils.Utils;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.StreamSupport;

/**
 * Represents a list of table columns.
 */
public final class TableColumnCollection {

    /**
     * List of column names sorted by their index.
     */
    private final List<String> names;

    /**
     * Map from column name to its index, the first column has index 0, the second 1 and so forth.
     */
    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column names collection.
     * <p>
     * The new instance will have its own copy of the input names.
     * </p>
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name iterable
     *                                  of names as determined by {@link #checkNames checkNames}.
     */
    public TableColumnCollection(final Iterable<String> names) {
        this(StreamSupport.stream(Utils.nonNull(names, "the names cannot be null").spliterator(), false).toArray(String[]::new));
    }

    /**
     * Creates a new table-column names collection.
     * <p>
     * The new instance will have its own copy of the input name array,
     * thus is safe to modify such an array after calling this constructor;
     * it won't modify the state of this object.
     * </p>
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name array
     *                                  of names as determined by {@link #checkNames checkNames}.
     */
    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(names.clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, a unmodifiable view to this collection column names.
     */
    public List<String> names() {
        return names;
    }

    /**
     * Returns the name of a column by its index.
     * <p>
     * Column indexes are 0-based.
     * </p>
     *
     * @param index the target column index.
     * @return never {@code null}.
     * @throws IllegalArgumentException if {@code index} is not a valid column index.
     */
    public String nameAt(final int index) {
        Utils.validIndex(index, names.size());
        return names.get(index);
    }

    /**
     * Returns the index of a column by its name.
     *
     * @param name the query column name.
     * @return {@code -1} if there is not such a column, 0 or greater otherwise.
     */
    public int indexOf(final String name) {
        Utils.nonNull(name, "the column name cannot be null");
        return indexByName.getOrDefault(name, -1);
    }

    /**
     * Check whether there is such a column by name.
     *
     * @param name the query name.
     * @return {@code true} iff there is a column with such a {@code name}.
     * @throws IllegalArgumentException if {@code name} is {@code null}.
     */
    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "cannot be null"));
    }

    /**
     * Returns the names in the input that are not columns of this collection, in their input order.
     *
     * @param names the names to test.
     * @return never {@code null}, empty if all names are present.
     * @throws IllegalArgumentException if {@code names} is {@code null} or contains any {@code null}.
     */
    public List<String> missing(final Iterable<String> names) {
        final List<String> result = new ArrayList<>();
        for (final String name : Utils.nonNull(names, "names cannot be null")) {
            if (!contains(name)) {
                result.add(name);
            }
        }
        return result;
    }

    /**
     * Returns the number of columns.
     */
    public int columnCount() {
        return names.size();
    }

    /**
     * Checks that a column name array is valid.
     *
     * <p>
     * Assuming that it is null-value free, a column name array is invalid if:
     * <ul>
     * <li>has length 0,</li>
     * <li>or contains repeats</li>
     * </ul>
     * </p>
     * <p>
     * Unlike comment lines, a first column name starting with {@link TableUtils#COMMENT_PREFIX} is allowed: several
     * fusion callers name their first column {@code #FusionName}.
     * </p>
     * <p>When the input array is invalid, an exception is thrown using the exception factory function provided.</p>
     *
     * @throws IllegalArgumentException if {@code columnNames} is {@code null}, or it contains any {@code null}, or {@code exceptionFactory} is {@code null} or ir returns a {@code null}
     *                                  when invoked.
     * @throws RuntimeException         if {@code columnNames} does not contain a valid list of column names. The exact type will depend on the
     *                                  input {@code exceptionFactory}.
     * @return never {@code null}, the same reference as the input column name array {@code columnNames}.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw Utils.nonNull(exceptionFactory.apply("there must be at least one column"));
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i],"no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw Utils.nonNull(exceptionFactory.apply("more than one column have the same name: " + columnNames[i]), "exception factory produces null exceptions");
            }
        }
        return columnNames;
    }
}
