package org.pivotspec.dates;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Week-of-year numbering.
 * <p>
 * The default numbering is ISO-8601: weeks start on Monday and week 1 is the week containing
 * the year's first Thursday. Dates early in January can therefore belong to week 52 or 53 of
 * the previous year, and dates late in December to week 1 of the next.
 */
public final class WeekNumbers {

    private WeekNumbers() {
        // Utility class
    }

    /**
     * Computes the ISO-8601 week number.
     * <p>
     * The date is shifted to the Thursday of its Monday-started week; the week number is the
     * count of 7-day blocks between that Thursday and January 1st of the Thursday's year.
     *
     * @param date the date
     * @return week number in {@code [1, 53]}
     */
    public static int isoWeek(LocalDate date) {
        int dayOfWeek = date.getDayOfWeek().getValue(); // Monday=1 .. Sunday=7
        LocalDate thursday = date.plusDays(4 - dayOfWeek);
        LocalDate yearStart = LocalDate.of(thursday.getYear(), 1, 1);
        long days = ChronoUnit.DAYS.between(yearStart, thursday);
        return (int) Math.ceil((days + 1) / 7.0);
    }

    /**
     * Computes the week number for the given week start.
     * <p>
     * {@link WeekStart#MON} uses ISO numbering. Other week starts use simple calendar
     * numbering: week 1 contains January 1st and a new week begins on every occurrence of the
     * first weekday.
     *
     * @param date      the date
     * @param weekStart first day of the week
     * @return week number, starting at 1
     */
    public static int weekNumber(LocalDate date, WeekStart weekStart) {
        if (weekStart == null || weekStart == WeekStart.MON) {
            return isoWeek(date);
        }
        LocalDate jan1 = LocalDate.of(date.getYear(), 1, 1);
        int offset = (jan1.getDayOfWeek().getValue() - weekStart.firstDay().getValue() + 7) % 7;
        return (date.getDayOfYear() - 1 + offset) / 7 + 1;
    }

    /**
     * Returns the first day of the week containing {@code date}.
     *
     * @param date      the date
     * @param weekStart first day of the week
     * @return the start of the week, at or before {@code date}
     */
    public static LocalDate startOfWeek(LocalDate date, WeekStart weekStart) {
        WeekStart ws = weekStart != null ? weekStart : WeekStart.MON;
        int back = (date.getDayOfWeek().getValue() - ws.firstDay().getValue() + 7) % 7;
        return date.minusDays(back);
    }
}
