package org.pivotspec.distinct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Response of the distinct endpoint. Values are strings, numbers or null.
 *
 * @param values raw distinct values
 */
public record DistinctResponse(List<Object> values) {

    public DistinctResponse {
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
