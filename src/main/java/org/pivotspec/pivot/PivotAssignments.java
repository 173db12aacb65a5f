package org.pivotspec.pivot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a widget visualizes: dimensions, values, grouping and exposed filters.
 * <p>
 * Instances are immutable; edits go through {@link PivotReducer}. Empty {@code x} and
 * {@code legend} lists mean "not set".
 *
 * @param x       dimension fields in order
 * @param legend  grouping fields in order
 * @param values  value assignments in order
 * @param filters fields exposed as filter chips, with or without a current value
 */
public record PivotAssignments(List<String> x, List<String> legend, List<ValueAssignment> values,
                               List<String> filters) {

    private static final PivotAssignments EMPTY = new PivotAssignments(List.of(), List.of(), List.of(), List.of());

    public PivotAssignments {
        x = x == null ? List.of() : List.copyOf(x);
        legend = legend == null ? List.of() : List.copyOf(legend);
        values = values == null ? List.of() : List.copyOf(values);
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static PivotAssignments empty() {
        return EMPTY;
    }

    /**
     * @param zone a field-list zone
     * @return the zone's fields
     */
    public List<String> fields(PivotZone zone) {
        return switch (zone) {
            case X -> x;
            case LEGEND -> legend;
            case FILTERS -> filters;
        };
    }

    /**
     * @param zone   a field-list zone
     * @param fields replacement fields
     * @return a copy with the zone replaced
     */
    public PivotAssignments withFields(PivotZone zone, List<String> fields) {
        return switch (zone) {
            case X -> new PivotAssignments(fields, legend, values, filters);
            case LEGEND -> new PivotAssignments(x, fields, values, filters);
            case FILTERS -> new PivotAssignments(x, legend, values, fields);
        };
    }

    public PivotAssignments withValues(List<ValueAssignment> newValues) {
        return new PivotAssignments(x, legend, newValues, filters);
    }

    /**
     * @return fields referenced by {@code x}, {@code legend} and field-based values
     */
    public Set<String> referencedFields() {
        Set<String> result = new LinkedHashSet<>(x);
        result.addAll(legend);
        for (ValueAssignment value : values) {
            if (value.field() != null) {
                result.add(value.field());
            }
        }
        return result;
    }

    /**
     * @return the first dimension, or null if none
     */
    public String firstX() {
        return x.isEmpty() ? null : x.get(0);
    }

    List<String> mutableFields(PivotZone zone) {
        return new ArrayList<>(fields(zone));
    }
}
