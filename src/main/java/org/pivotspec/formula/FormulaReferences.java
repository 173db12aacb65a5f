package org.pivotspec.formula;

import java.util.List;

/**
 * Columns a formula references.
 *
 * @param row   per-row references
 * @param range whole-column references
 */
public record FormulaReferences(List<String> row, List<String> range) {

    public FormulaReferences {
        row = row == null ? List.of() : List.copyOf(row);
        range = range == null ? List.of() : List.copyOf(range);
    }
}
