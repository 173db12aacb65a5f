package org.pivotspec.dates;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves date presets and custom date filters into half-open ranges.
 * <p>
 * All ranges are {@code [gte, lt)}: {@code lt} is the day <em>after</em> the inclusive end, so
 * consumers can compare with {@code >=} and {@code <} regardless of time-of-day components.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * DateRanges.resolvePreset(DatePreset.TODAY, LocalDate.of(2024, 3, 15));
 * // -> gte=2024-03-15, lt=2024-03-16
 * DateRanges.resolveCustomRange(CustomRangeOp.BETWEEN, "2024-01-01", "2024-01-31");
 * // -> gte=2024-01-01, lt=2024-02-01
 * }</pre>
 */
public final class DateRanges {

    private DateRanges() {
        // Utility class
    }

    /**
     * Resolves a preset relative to {@code today}. Week presets start on Monday.
     *
     * @param preset the preset
     * @param today  the reference day
     * @return the half-open range
     */
    public static DateRange resolvePreset(DatePreset preset, LocalDate today) {
        return resolvePreset(preset, today, WeekStart.MON);
    }

    /**
     * Resolves a preset relative to {@code today}.
     *
     * @param preset    the preset
     * @param today     the reference day
     * @param weekStart first day of the week for week presets
     * @return the half-open range
     */
    public static DateRange resolvePreset(DatePreset preset, LocalDate today, WeekStart weekStart) {
        Objects.requireNonNull(preset, "preset");
        Objects.requireNonNull(today, "today");
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate quarterStart = quarterStart(today);
        LocalDate yearStart = today.withDayOfYear(1);
        LocalDate weekStartDay = WeekNumbers.startOfWeek(today, weekStart);

        return switch (preset) {
            case TODAY -> DateRange.of(today, today.plusDays(1));
            case YESTERDAY -> DateRange.of(today.minusDays(1), today);
            case THIS_WEEK -> DateRange.of(weekStartDay, weekStartDay.plusWeeks(1));
            case LAST_WEEK -> DateRange.of(weekStartDay.minusWeeks(1), weekStartDay);
            case THIS_MONTH -> DateRange.of(monthStart, monthStart.plusMonths(1));
            case LAST_MONTH -> DateRange.of(monthStart.minusMonths(1), monthStart);
            case THIS_QUARTER -> DateRange.of(quarterStart, quarterStart.plusMonths(3));
            // minusMonths rolls Q1 back into Q4 of the previous year
            case LAST_QUARTER -> DateRange.of(quarterStart.minusMonths(3), quarterStart);
            case THIS_YEAR -> DateRange.of(yearStart, yearStart.plusYears(1));
            case LAST_YEAR -> DateRange.of(yearStart.minusYears(1), yearStart);
            case LAST_7_DAYS -> rolling(today, 7);
            case LAST_30_DAYS -> rolling(today, 30);
            case LAST_90_DAYS -> rolling(today, 90);
        };
    }

    /**
     * Resolves a custom date filter. Bounds are end-inclusive user input.
     * <ul>
     *   <li>{@code after a}: {@code gte = a}</li>
     *   <li>{@code before b}: {@code lt = b + 1 day}; falls back to {@code a} when {@code b} is blank</li>
     *   <li>{@code between a b}: {@code gte = a}, {@code lt = b + 1 day}</li>
     * </ul>
     * Blank or unparseable bounds are left unset rather than emitted.
     *
     * @param op operator
     * @param a  first input, may be null
     * @param b  second input, may be null
     * @return the half-open range, possibly unbounded
     */
    public static DateRange resolveCustomRange(CustomRangeOp op, String a, String b) {
        Objects.requireNonNull(op, "op");
        LocalDate first = FlexibleDateParser.parseDate(blankToNull(a));
        LocalDate second = FlexibleDateParser.parseDate(blankToNull(b));

        return switch (op) {
            case AFTER -> DateRange.of(first, null);
            case BEFORE -> {
                LocalDate end = second != null ? second : first;
                yield DateRange.of(null, end != null ? end.plusDays(1) : null);
            }
            case BETWEEN -> DateRange.of(first, second != null ? second.plusDays(1) : null);
        };
    }

    /**
     * Finds the preset whose range for {@code today} equals the given range.
     *
     * @param range     a resolved range
     * @param today     the reference day
     * @param weekStart first day of the week for week presets
     * @return the first matching preset in declaration order, or empty
     */
    public static Optional<DatePreset> matchPreset(DateRange range, LocalDate today, WeekStart weekStart) {
        if (range == null || range.gte() == null || range.lt() == null) {
            return Optional.empty();
        }
        for (DatePreset preset : DatePreset.values()) {
            if (resolvePreset(preset, today, weekStart).equals(range)) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }

    /**
     * @param date any day
     * @return the first day of the date's calendar quarter
     */
    public static LocalDate quarterStart(LocalDate date) {
        int quarterIndex = (date.getMonthValue() - 1) / 3;
        return LocalDate.of(date.getYear(), quarterIndex * 3 + 1, 1);
    }

    private static DateRange rolling(LocalDate today, int days) {
        return DateRange.of(today.minusDays(days - 1L), today.plusDays(1));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
