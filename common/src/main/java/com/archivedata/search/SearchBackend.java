package com.archivedata.search;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The remote, paginated and filterable document collection being exported.
 *
 * <p>Implementations are shared by all export workers, so every method must be safe to call
 * concurrently.  Each call is one stateless round-trip.</p>
 */
public interface SearchBackend extends Closeable {

    /**
     * Counts the documents matching the filter.
     */
    long count(RangeFilter filter) throws IOException;

    /**
     * Returns one page of documents matching the filter, ordered by {@code sortField}.
     *
     * @param skip number of leading matches to skip; {@code skip + top} must not exceed
     *             {@link #getPageDepthLimit()}
     * @param top  maximum number of documents to return
     * @return the documents' source fields, in sort order
     */
    List<Map<String, Object>> query(RangeFilter filter, String sortField, SortDirection direction,
                                    int skip, int top) throws IOException;

    /**
     * Returns the sort value of the first document having {@code sortField}, sorted in the
     * given direction, or {@code null} when no document has the field.  One single-document
     * query.  A multi-valued field sorts by its smallest value ascending and its largest
     * descending.
     */
    Object firstSortValue(String sortField, SortDirection direction) throws IOException;

    /**
     * Describes a single field of the collection.
     *
     * @return the descriptor, or {@code null} when the field does not exist
     */
    FieldDescriptor describeField(String field) throws IOException;

    /**
     * The deepest position ({@code skip + top}) a single query may reach.
     */
    int getPageDepthLimit();

    /** Where the collection lives, as recorded in partition files. */
    String getEndpoint();

    /** Name of the collection. */
    String getIndexName();
}
