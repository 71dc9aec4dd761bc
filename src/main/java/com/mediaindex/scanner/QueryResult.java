package com.mediaindex.scanner;

/**
 * Cursor over the rows returned by {@link MediaSource#query(String, String, String)}.
 * <p>
 * The cursor starts before the first row. Column offsets are resolved by name with
 * {@link #columnIndex(String)} and then used with the typed getters. Read failures are
 * raised as {@link MediaSourceException}.
 */
public interface QueryResult extends AutoCloseable {

    /**
     * @return true if the result contains at least one row
     */
    boolean hasRows();

    /**
     * Moves to the next row.
     * @return false once the rows are exhausted
     */
    boolean next();

    /**
     * @param columnName column name
     * @return zero-based offset of the column, or -1 if the result has no such column
     */
    int columnIndex(String columnName);

    /**
     * @param columnIndex offset from {@link #columnIndex(String)}
     * @return true if the current row holds no value for the column
     */
    boolean isNull(int columnIndex);

    String getString(int columnIndex);

    long getLong(int columnIndex);

    /**
     * Releases the resources behind this result. Narrowed to throw nothing.
     */
    @Override
    void close();
}
