package org.pivotspec.distinct;

import java.util.Objects;

/**
 * Request for one page of query results.
 *
 * @param spec         the query
 * @param datasourceId datasource identity, may be null
 * @param limit        page size
 * @param offset       rows to skip
 * @param includeTotal whether the backend should report the total row count
 */
public record PagedQueryRequest(QuerySpecFragment spec, String datasourceId, int limit, int offset,
                                boolean includeTotal) {

    public PagedQueryRequest {
        Objects.requireNonNull(spec, "spec");
    }
}
