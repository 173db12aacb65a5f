package org.pivotspec.predicate;

import java.util.Optional;

/**
 * Operators of a number filter rule.
 */
public enum NumberOperator {
    EQ("eq", PredicateOperator.EQ),
    NE("ne", PredicateOperator.NE),
    GT("gt", PredicateOperator.GT),
    GTE("gte", PredicateOperator.GTE),
    LT("lt", PredicateOperator.LT),
    LTE("lte", PredicateOperator.LTE),
    /** Inclusive on both ends; written as {@code __gte} and {@code __lte}. */
    BETWEEN("between", null);

    private final String id;
    private final PredicateOperator predicate;

    NumberOperator(String id, PredicateOperator predicate) {
        this.id = id;
        this.predicate = predicate;
    }

    public String id() {
        return id;
    }

    /**
     * @return the single predicate operator, or null for {@link #BETWEEN}
     */
    public PredicateOperator predicate() {
        return predicate;
    }

    public static Optional<NumberOperator> fromId(String id) {
        for (NumberOperator op : values()) {
            if (op.id.equals(id)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
