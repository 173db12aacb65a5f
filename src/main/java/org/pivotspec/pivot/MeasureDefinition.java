package org.pivotspec.pivot;

import java.util.Objects;

/**
 * A named, reusable aggregate formula.
 *
 * @param id      stable identifier referenced by value assignments
 * @param name    display name
 * @param formula formula text handed to the backend
 */
public record MeasureDefinition(String id, String name, String formula) {

    public MeasureDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(formula, "formula");
        if (name == null || name.isBlank()) {
            name = id;
        }
    }
}
