package com.mediaindex.scanner;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column offsets of one query, resolved once from {@link MediaColumnRegistry} and then
 * used for every row. The getters substitute a default whenever the column is missing
 * from the result or the current row holds null.
 */
public final class ColumnOffsets {
    private final QueryResult result;
    private final Map<MediaColumn, Integer> offsets;

    private ColumnOffsets(QueryResult result, Map<MediaColumn, Integer> offsets) {
        this.result = result;
        this.offsets = offsets;
    }

    /**
     * Resolves the offsets of every registry column of {@code context} in {@code result}.
     * @param result open query result
     * @param context naming scheme of the query
     * @return resolved offsets bound to {@code result}
     */
    public static ColumnOffsets resolve(QueryResult result, ColumnContext context) {
        List<MediaColumn> columns = MediaColumnRegistry.getColumns(context);
        Map<MediaColumn, Integer> offsets = new HashMap<>();
        for (MediaColumn column : columns) {
            String name = column.columnName(context);
            offsets.put(column, name == null ? -1 : result.columnIndex(name));
        }
        return new ColumnOffsets(result, offsets);
    }

    /**
     * @return offset of {@code column}, -1 when the query has no such column
     */
    public int offset(MediaColumn column) {
        return offsets.getOrDefault(column, -1);
    }

    /**
     * Text value of the current row, or {@code defaultValue} when absent.
     */
    public String getString(MediaColumn column, String defaultValue) {
        int offset = offset(column);
        if (offset < 0 || result.isNull(offset)) return defaultValue;
        String value = result.getString(offset);
        return value == null ? defaultValue : value;
    }

    /**
     * Integer value of the current row, or {@code defaultValue} when absent.
     */
    public long getLong(MediaColumn column, long defaultValue) {
        int offset = offset(column);
        if (offset < 0 || result.isNull(offset)) return defaultValue;
        return result.getLong(offset);
    }
}
