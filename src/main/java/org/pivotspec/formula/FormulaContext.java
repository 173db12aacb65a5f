package org.pivotspec.formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluation context of a formula.
 *
 * @param row   values of the current row, referenced as {@code [@column]}
 * @param range whole-column values, referenced as {@code [column]}
 */
public record FormulaContext(Map<String, Object> row, Map<String, List<Object>> range) {

    public FormulaContext {
        row = row == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(row));
        range = range == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(range));
    }

    public static FormulaContext ofRow(Map<String, Object> row) {
        return new FormulaContext(row, Map.of());
    }
}
