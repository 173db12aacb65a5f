package org.pivotspec.dates;

import java.util.Locale;

/**
 * Period comparisons offered by KPI widgets.
 */
public enum DeltaMode {
    /** Today vs yesterday. */
    TD_YSTD,
    /** This week vs last week. */
    TW_LW,
    /** This month vs last month (full months). */
    MONTH_LMONTH,
    /** Month to date vs the same span of last month. */
    MTD_LMTD,
    /** This year vs last year (full years). */
    TY_LY,
    /** Year to date vs the same span of last year. */
    YTD_LYTD,
    /** This quarter vs last quarter (full quarters). */
    TQ_LQ;

    /**
     * @param id wire identifier, case-insensitive
     * @return the mode
     * @throws IllegalArgumentException if unknown
     */
    public static DeltaMode fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
