package org.pivotspec.predicate;

import java.util.Optional;

/**
 * Operators stored as sibling keys on a where clause.
 * <p>
 * {@link #EQ} is the bare field key holding an equality set (array); every other operator is
 * stored under {@code field__<suffix>}.
 */
public enum PredicateOperator {
    EQ(null),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    CONTAINS("contains"),
    NOT_CONTAINS("notcontains"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith");

    /** Separator between field name and operator suffix. */
    public static final String SEPARATOR = "__";

    private final String suffix;

    PredicateOperator(String suffix) {
        this.suffix = suffix;
    }

    /**
     * @return the key suffix without separator, or null for {@link #EQ}
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Builds the where-clause key for a field.
     *
     * @param field base field name
     * @return {@code field} for {@link #EQ}, otherwise {@code field__suffix}
     */
    public String key(String field) {
        return suffix == null ? field : field + SEPARATOR + suffix;
    }

    /**
     * @param suffix a key suffix without separator
     * @return the operator using that suffix, or empty
     */
    public static Optional<PredicateOperator> fromSuffix(String suffix) {
        for (PredicateOperator op : values()) {
            if (op.suffix != null && op.suffix.equals(suffix)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
