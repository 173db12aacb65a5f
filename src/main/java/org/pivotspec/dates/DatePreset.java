package org.pivotspec.dates;

import java.util.Optional;

/**
 * Named relative date ranges offered by date filters.
 */
public enum DatePreset {
    TODAY("today"),
    YESTERDAY("yesterday"),
    THIS_WEEK("this_week"),
    LAST_WEEK("last_week"),
    THIS_MONTH("this_month"),
    LAST_MONTH("last_month"),
    THIS_QUARTER("this_quarter"),
    LAST_QUARTER("last_quarter"),
    THIS_YEAR("this_year"),
    LAST_YEAR("last_year"),
    LAST_7_DAYS("last_7_days"),
    LAST_30_DAYS("last_30_days"),
    LAST_90_DAYS("last_90_days");

    private final String id;

    DatePreset(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @param id wire identifier such as {@code last_quarter}
     * @return the preset, or empty if unknown
     */
    public static Optional<DatePreset> fromId(String id) {
        for (DatePreset preset : values()) {
            if (preset.id.equals(id)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }
}
