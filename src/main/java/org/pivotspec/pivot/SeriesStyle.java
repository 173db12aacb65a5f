package org.pivotspec.pivot;

import java.util.Locale;

/**
 * Fill style of a chart series.
 */
public enum SeriesStyle {
    SOLID,
    GRADIENT;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SeriesStyle fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
