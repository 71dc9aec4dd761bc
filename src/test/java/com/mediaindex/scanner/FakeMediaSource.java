package com.mediaindex.scanner;

import java.util.*;

/**
 * In-memory {@link MediaSource} for tests.
 * <p>
 * Understands selections of the form {@code column != 0} and sort orders of the form
 * {@code a ASC, b ASC}. Collections that were never registered yield no result (null).
 */
class FakeMediaSource implements MediaSource {
    final List<String> queries = new ArrayList<>();
    final List<FakeResult> opened = new ArrayList<>();
    private final Map<String, List<Map<String, Object>>> collections = new HashMap<>();
    private final Map<String, Integer> failAfterRows = new HashMap<>();

    FakeMediaSource with(String collection, List<Map<String, Object>> rows) {
        collections.put(collection, rows);
        return this;
    }

    /** Makes reads of {@code collection} fail once {@code rows} rows have been consumed. */
    FakeMediaSource failingAfter(String collection, int rows) {
        failAfterRows.put(collection, rows);
        return this;
    }

    static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) row.put((String) keyValues[i], keyValues[i + 1]);
        return row;
    }

    @Override
    public QueryResult query(String collection, String selection, String sortOrder) {
        queries.add(collection + " | " + selection + " | " + sortOrder);
        List<Map<String, Object>> rows = collections.get(collection);
        if (rows == null) return null;
        List<Map<String, Object>> selected = new ArrayList<>();
        for (Map<String, Object> r : rows) if (matches(r, selection)) selected.add(r);
        if (sortOrder != null) selected.sort(comparator(sortOrder));
        FakeResult result = new FakeResult(selected, failAfterRows.getOrDefault(collection, -1));
        opened.add(result);
        return result;
    }

    private static boolean matches(Map<String, Object> r, String selection) {
        if (selection == null) return true;
        String column = selection.replace("!= 0", "").trim();
        Object value = r.get(column);
        return value instanceof Number && ((Number) value).longValue() != 0;
    }

    private static Comparator<Map<String, Object>> comparator(String sortOrder) {
        Comparator<Map<String, Object>> result = null;
        for (String term : sortOrder.split(",")) {
            String column = term.trim().split("\\s+")[0];
            Comparator<Map<String, Object>> next = Comparator.comparing(r -> String.valueOf(r.get(column)));
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    static final class FakeResult implements QueryResult {
        private final List<Map<String, Object>> rows;
        private final List<String> columns;
        private final int failAfter;
        private int position = -1;
        int closeCount;

        FakeResult(List<Map<String, Object>> rows, int failAfter) {
            this.rows = rows;
            this.failAfter = failAfter;
            Set<String> names = new LinkedHashSet<>();
            for (Map<String, Object> r : rows) names.addAll(r.keySet());
            this.columns = new ArrayList<>(names);
        }

        @Override
        public boolean hasRows() {
            return !rows.isEmpty();
        }

        @Override
        public boolean next() {
            if (failAfter >= 0 && position + 1 >= failAfter) {
                throw new MediaSourceException("simulated read failure", null);
            }
            position++;
            return position < rows.size();
        }

        @Override
        public int columnIndex(String columnName) {
            return columns.indexOf(columnName);
        }

        @Override
        public boolean isNull(int columnIndex) {
            return rows.get(position).get(columns.get(columnIndex)) == null;
        }

        @Override
        public String getString(int columnIndex) {
            Object value = rows.get(position).get(columns.get(columnIndex));
            return value == null ? null : value.toString();
        }

        @Override
        public long getLong(int columnIndex) {
            Object value = rows.get(position).get(columns.get(columnIndex));
            return value == null ? 0 : ((Number) value).longValue();
        }

        @Override
        public void close() {
            closeCount++;
        }
    }
}
