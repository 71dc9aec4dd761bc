package com.mediaindex.scanner;

/**
 * Read-only tabular store of media metadata.
 * <p>
 * Collections are addressed by the identifiers in {@link MediaCollections}. Rows are
 * exposed by column name through {@link QueryResult}; the column set depends on the
 * collection.
 */
public interface MediaSource {

    /**
     * Runs a query against one collection.
     * @param collection collection identifier, see {@link MediaCollections}
     * @param selection filter expression over the collection's columns, or null for all rows
     * @param sortOrder sort expression, or null for the collection's native order
     * @return an open result that the caller must close, or null when the source yields no result
     */
    QueryResult query(String collection, String selection, String sortOrder);
}
