package org.pivotspec.pivot;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.pivotspec.dates.DerivedDateField;

/**
 * The set of field names a widget may reference.
 * <p>
 * Derived date-part names such as {@code "OrderDate (Month)"} are members whenever their base
 * field is a member.
 */
public final class FieldUniverse {

    private final Set<String> fields;

    private FieldUniverse(Set<String> fields) {
        this.fields = Collections.unmodifiableSet(fields);
    }

    /**
     * @param schemaColumns    columns of the source table
     * @param customColumns    widget custom columns
     * @param transformOutputs datasource-level transform outputs
     * @return the universe
     */
    public static FieldUniverse of(Collection<String> schemaColumns, Collection<CustomColumn> customColumns,
                                   Collection<String> transformOutputs) {
        Set<String> all = new LinkedHashSet<>();
        if (schemaColumns != null) {
            all.addAll(schemaColumns);
        }
        if (customColumns != null) {
            for (CustomColumn column : customColumns) {
                all.add(column.name());
            }
        }
        if (transformOutputs != null) {
            all.addAll(transformOutputs);
        }
        return new FieldUniverse(all);
    }

    public static FieldUniverse ofFields(Collection<String> fields) {
        return of(fields, null, null);
    }

    public boolean contains(String field) {
        if (fields.contains(field)) {
            return true;
        }
        return DerivedDateField.parse(field)
            .map(derived -> fields.contains(derived.baseField()))
            .orElse(false);
    }

    /**
     * @return the explicit members, without derived names
     */
    public Set<String> fields() {
        return fields;
    }
}
