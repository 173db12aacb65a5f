package org.pivotspec.distinct;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The subset of a query specification sent with paged scans.
 *
 * @param source source table
 * @param select selected columns
 * @param where  filter context
 * @param agg    aggregation hint, e.g. {@code distinct}; may be null
 */
public record QuerySpecFragment(String source, List<String> select, Map<String, Object> where, String agg) {

    public QuerySpecFragment {
        Objects.requireNonNull(source, "source");
        select = select == null ? List.of() : List.copyOf(select);
        where = where == null ? Map.of() : where;
    }
}
