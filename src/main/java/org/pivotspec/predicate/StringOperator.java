package org.pivotspec.predicate;

import java.util.Optional;

/**
 * Operators of a string filter rule, with their UI identifiers.
 */
public enum StringOperator {
    CONTAINS("contains", PredicateOperator.CONTAINS),
    NOT_CONTAINS("not_contains", PredicateOperator.NOT_CONTAINS),
    EQ("eq", PredicateOperator.EQ),
    NE("ne", PredicateOperator.NE),
    STARTS_WITH("starts_with", PredicateOperator.STARTS_WITH),
    ENDS_WITH("ends_with", PredicateOperator.ENDS_WITH);

    private final String id;
    private final PredicateOperator predicate;

    StringOperator(String id, PredicateOperator predicate) {
        this.id = id;
        this.predicate = predicate;
    }

    public String id() {
        return id;
    }

    public PredicateOperator predicate() {
        return predicate;
    }

    public static Optional<StringOperator> fromId(String id) {
        for (StringOperator op : values()) {
            if (op.id.equals(id)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
