package org.pivotspec.query;

/**
 * Widget kinds; each selects a compilation policy.
 */
public enum WidgetType {
    KPI("kpi"),
    CHART("chart"),
    DATA_TABLE("table"),
    PIVOT_TABLE("pivot");

    private final String id;

    WidgetType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @param id wire identifier
     * @return the widget type
     * @throws IllegalArgumentException if unknown
     */
    public static WidgetType fromId(String id) {
        for (WidgetType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown widget type: " + id);
    }
}
