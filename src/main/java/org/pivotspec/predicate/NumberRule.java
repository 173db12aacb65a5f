package org.pivotspec.predicate;

import java.util.Objects;

/**
 * Rule-based number filter.
 *
 * @param operator the comparison
 * @param a        operand, or lower bound for {@link NumberOperator#BETWEEN}; may be null
 * @param b        upper bound for {@link NumberOperator#BETWEEN}; ignored otherwise, may be null
 */
public record NumberRule(NumberOperator operator, Number a, Number b) implements FilterRule {

    public NumberRule {
        Objects.requireNonNull(operator, "operator");
    }

    /**
     * Creates a single-operand rule.
     */
    public static NumberRule of(NumberOperator operator, Number a) {
        return new NumberRule(operator, a, null);
    }

    /**
     * Creates a between rule; either bound may be null.
     */
    public static NumberRule between(Number low, Number high) {
        return new NumberRule(NumberOperator.BETWEEN, low, high);
    }

    @Override
    public boolean appliesTo(FieldKind kind) {
        return kind == FieldKind.NUMBER;
    }
}
