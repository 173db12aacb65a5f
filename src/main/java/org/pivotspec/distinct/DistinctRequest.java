package org.pivotspec.distinct;

import java.util.Map;
import java.util.Objects;

/**
 * Request to the backend's distinct endpoint.
 *
 * @param source       source table ({@code schema.table} or {@code table})
 * @param field        field whose distinct values are requested
 * @param where        filter context, may be empty
 * @param datasourceId datasource identity, may be null
 */
public record DistinctRequest(String source, String field, Map<String, Object> where, String datasourceId) {

    public DistinctRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(field, "field");
        where = where == null ? Map.of() : where;
    }
}
