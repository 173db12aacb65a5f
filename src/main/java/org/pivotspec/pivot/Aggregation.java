package org.pivotspec.pivot;

import java.util.Locale;

/**
 * Aggregator applied to a value assignment.
 */
public enum Aggregation {
    NONE,
    COUNT,
    DISTINCT,
    AVG,
    SUM,
    MIN,
    MAX;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id wire identifier such as {@code sum}
     * @return the aggregation
     * @throws IllegalArgumentException if unknown
     */
    public static Aggregation fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
