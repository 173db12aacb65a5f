package org.pivotspec.pivot;

import java.util.Objects;

/**
 * A widget-level computed column.
 *
 * @param id      identifier
 * @param name    column name as it appears in the field list
 * @param formula row formula
 * @param type    declared result type ({@code number}, {@code string}, {@code date}, {@code boolean}), may be null
 */
public record CustomColumn(String id, String name, String formula, String type) {

    public CustomColumn {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(formula, "formula");
    }
}
