package com.mediaindex.scanner;

import java.util.EnumMap;
import java.util.Map;

/**
 * A semantic record field and the source column it is read from in each
 * {@link ColumnContext}. A context with no entry has no column for the field.
 */
public class MediaColumn {
    public final String fieldName;
    private final Map<ColumnContext, String> columnNames;

    public MediaColumn(String fieldName, Map<ColumnContext, String> columnNames) {
        this.fieldName = fieldName;
        this.columnNames = columnNames.isEmpty() ? new EnumMap<>(ColumnContext.class) : new EnumMap<>(columnNames);
    }

    /**
     * @param context query context
     * @return the column name in that context, or null if the field has none there
     */
    public String columnName(ColumnContext context) {
        return columnNames.get(context);
    }

    @Override
    public String toString() {
        return fieldName;
    }
}
