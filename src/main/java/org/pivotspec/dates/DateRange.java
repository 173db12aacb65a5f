package org.pivotspec.dates;

import java.time.LocalDate;

/**
 * Half-open date range {@code [gte, lt)} with {@code YYYY-MM-DD} bounds.
 * <p>
 * Either bound may be null, meaning unbounded on that side.
 *
 * @param gte inclusive lower bound, or null
 * @param lt  exclusive upper bound, or null
 */
public record DateRange(String gte, String lt) {

    /**
     * Creates a range from dates.
     *
     * @param gte inclusive lower bound, or null
     * @param lt  exclusive upper bound, or null
     * @return the range
     */
    public static DateRange of(LocalDate gte, LocalDate lt) {
        return new DateRange(gte != null ? gte.toString() : null, lt != null ? lt.toString() : null);
    }

    /**
     * @return true if neither bound is set
     */
    public boolean isUnbounded() {
        return gte == null && lt == null;
    }
}
