package org.pivotspec.json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.predicate.FieldFilter;
import org.pivotspec.query.QuerySpec;
import org.pivotspec.query.WidgetConfig;

/**
 * A widget as stored in a dashboard document.
 *
 * @param widget      widget configuration
 * @param pivot       pivot assignments
 * @param querySpec   the persisted spec, or null for a new widget
 * @param filterRules current filter state per field, in document order
 */
public record WidgetDocument(WidgetConfig widget, PivotAssignments pivot, QuerySpec querySpec,
                             Map<String, FieldFilter> filterRules) {

    public WidgetDocument {
        Objects.requireNonNull(widget, "widget");
        pivot = pivot == null ? PivotAssignments.empty() : pivot;
        filterRules = filterRules == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(filterRules));
    }
}
