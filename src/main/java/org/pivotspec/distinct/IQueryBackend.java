package org.pivotspec.distinct;

/**
 * Client of the remote query-execution backend.
 * <p>
 * Implementations own transport concerns such as timeouts and retries.
 */
public interface IQueryBackend {

    /**
     * @return true if the backend exposes a distinct endpoint
     */
    default boolean supportsDistinct() {
        return true;
    }

    /**
     * Fetches distinct values of a field.
     *
     * @param request the request
     * @return the values
     * @throws BackendException if the call fails
     */
    DistinctResponse distinct(DistinctRequest request) throws BackendException;

    /**
     * Fetches one page of query results.
     *
     * @param request the request
     * @return the page
     * @throws BackendException if the call fails
     */
    PagedQueryResponse query(PagedQueryRequest request) throws BackendException;
}
