package org.pivotspec.distinct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of query results.
 *
 * @param columns   column names
 * @param rows      row values, positionally matching {@code columns}
 * @param totalRows total row count if requested and known, otherwise null
 */
public record PagedQueryResponse(List<String> columns, List<List<Object>> rows, Long totalRows) {

    public PagedQueryResponse {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /**
     * Locates a field's column, falling back to the first column.
     *
     * @param field column name
     * @return the index of {@code field}, or 0 if absent
     */
    public int columnIndex(String field) {
        int idx = columns.indexOf(field);
        return idx >= 0 ? idx : 0;
    }
}
