package org.pivotspec.pivot;

/**
 * Field-list zones of the pivot builder. Values have their own patches.
 */
public enum PivotZone {
    /** Dimensions; rows in pivot mode. */
    X,
    /** Grouping; columns in pivot mode, selected columns in data-table mode. */
    LEGEND,
    /** Exposed filter chips. */
    FILTERS
}
