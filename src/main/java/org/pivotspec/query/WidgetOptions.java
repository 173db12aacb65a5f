package org.pivotspec.query;

import org.pivotspec.dates.DeltaMode;
import org.pivotspec.dates.WeekStart;

/**
 * Type-specific widget options. The variant determines the widget's {@link WidgetType}.
 */
public sealed interface WidgetOptions {

    WidgetType type();

    /**
     * KPI options.
     *
     * @param deltaMode      period comparison, may be null
     * @param deltaDateField date field the comparison is computed on, may be null
     * @param deltaWeekStart week start for weekly comparisons, may be null
     */
    record Kpi(DeltaMode deltaMode, String deltaDateField, WeekStart deltaWeekStart) implements WidgetOptions {

        public static Kpi plain() {
            return new Kpi(null, null, null);
        }

        @Override
        public WidgetType type() {
            return WidgetType.KPI;
        }
    }

    /**
     * Chart options.
     *
     * @param chartType rendering hint such as {@code line} or {@code bar}, may be null
     * @param groupBy   date bucket of the x dimension, may be null
     * @param weekStart week start for weekly buckets, may be null
     */
    record Chart(String chartType, DateGrouping groupBy, WeekStart weekStart) implements WidgetOptions {

        public static Chart plain() {
            return new Chart(null, null, null);
        }

        @Override
        public WidgetType type() {
            return WidgetType.CHART;
        }
    }

    /**
     * Data table options.
     *
     * @param pageSize rows per page, may be null
     */
    record DataTable(Integer pageSize) implements WidgetOptions {

        @Override
        public WidgetType type() {
            return WidgetType.DATA_TABLE;
        }
    }

    /**
     * Pivot table options.
     *
     * @param rowTotals    show row totals
     * @param columnTotals show column totals
     */
    record PivotTable(boolean rowTotals, boolean columnTotals) implements WidgetOptions {

        @Override
        public WidgetType type() {
            return WidgetType.PIVOT_TABLE;
        }
    }
}
