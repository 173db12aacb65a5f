package org.pivotspec.dates;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * First day of a calendar week, as used by week grouping and week presets.
 */
public enum WeekStart {
    MON("mon", DayOfWeek.MONDAY),
    SUN("sun", DayOfWeek.SUNDAY),
    SAT("sat", DayOfWeek.SATURDAY);

    private final String id;
    private final DayOfWeek firstDay;

    WeekStart(String id, DayOfWeek firstDay) {
        this.id = id;
        this.firstDay = firstDay;
    }

    /**
     * @return the wire identifier ({@code mon}, {@code sun} or {@code sat})
     */
    public String id() {
        return id;
    }

    public DayOfWeek firstDay() {
        return firstDay;
    }

    /**
     * Resolves a wire identifier.
     *
     * @param id identifier, case-insensitive; null selects {@link #MON}
     * @return the matching week start
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static WeekStart fromId(String id) {
        if (id == null || id.isBlank()) {
            return MON;
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (WeekStart ws : values()) {
            if (ws.id.equals(normalized)) {
                return ws;
            }
        }
        throw new IllegalArgumentException("Unknown week start: " + id);
    }
}
