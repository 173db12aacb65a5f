package org.pivotspec.query;

import java.util.Locale;

/**
 * Time bucket applied to a date dimension.
 */
public enum DateGrouping {
    NONE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DateGrouping fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
