package org.pivotspec.predicate;

import java.util.Objects;

/**
 * Rule-based string filter.
 *
 * @param operator the comparison
 * @param value    typed text; several values may be separated by commas
 */
public record StringRule(StringOperator operator, String value) implements FilterRule {

    public StringRule {
        Objects.requireNonNull(operator, "operator");
    }

    @Override
    public boolean appliesTo(FieldKind kind) {
        return kind == FieldKind.STRING;
    }
}
