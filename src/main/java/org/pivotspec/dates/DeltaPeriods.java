package org.pivotspec.dates;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Current and previous comparison periods for a KPI delta.
 * <p>
 * Both periods are half-open. For "to date" modes the current period ends after today and the
 * previous period covers the same number of elapsed days, clamped to the previous period's own
 * length (March 31st compares against all of February).
 *
 * @param current  the current period
 * @param previous the comparison period
 */
public record DeltaPeriods(DateRange current, DateRange previous) {

    public DeltaPeriods {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(previous, "previous");
    }

    /**
     * Resolves the periods of a delta mode.
     *
     * @param mode      the comparison mode
     * @param today     the reference day
     * @param weekStart first day of the week for {@link DeltaMode#TW_LW}
     * @return the periods
     */
    public static DeltaPeriods resolve(DeltaMode mode, LocalDate today, WeekStart weekStart) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(today, "today");
        LocalDate tomorrow = today.plusDays(1);
        LocalDate monthStart = today.withDayOfMonth(1);
        LocalDate yearStart = today.withDayOfYear(1);

        return switch (mode) {
            case TD_YSTD -> of(today, tomorrow, today.minusDays(1), today);
            case TW_LW -> {
                LocalDate ws = WeekNumbers.startOfWeek(today, weekStart);
                yield of(ws, ws.plusWeeks(1), ws.minusWeeks(1), ws);
            }
            case MONTH_LMONTH -> of(monthStart, monthStart.plusMonths(1), monthStart.minusMonths(1), monthStart);
            case MTD_LMTD -> toDate(monthStart, tomorrow, monthStart.minusMonths(1));
            case TY_LY -> of(yearStart, yearStart.plusYears(1), yearStart.minusYears(1), yearStart);
            case YTD_LYTD -> toDate(yearStart, tomorrow, yearStart.minusYears(1));
            case TQ_LQ -> {
                LocalDate qs = DateRanges.quarterStart(today);
                yield of(qs, qs.plusMonths(3), qs.minusMonths(3), qs);
            }
        };
    }

    /**
     * Removes a delta date field's own predicate keys from a where clause, so the delta periods
     * are not intersected with an unrelated date filter on the same field.
     *
     * @param where     current where clause, may be null
     * @param dateField the delta date field, may be null
     * @return a new map without the field's equality and range keys
     */
    public static Map<String, Object> stripDateConstraints(Map<String, Object> where, String dateField) {
        Map<String, Object> result = new LinkedHashMap<>(where != null ? where : Map.of());
        if (dateField != null) {
            result.remove(dateField);
            result.remove(dateField + "__gte");
            result.remove(dateField + "__lte");
            result.remove(dateField + "__gt");
            result.remove(dateField + "__lt");
        }
        return result;
    }

    /**
     * Percentage change from {@code previous} to {@code current}.
     * <p>
     * A zero previous value yields 100 when the current value is non-zero, otherwise 0.
     *
     * @param current  current total
     * @param previous previous total
     * @return change in percent
     */
    public static double changePercent(double current, double previous) {
        if (!Double.isFinite(current) && !Double.isFinite(previous)) {
            return 0;
        }
        if (previous == 0) {
            return current != 0 ? 100 : 0;
        }
        return (current - previous) / Math.abs(previous) * 100;
    }

    private static DeltaPeriods toDate(LocalDate start, LocalDate end, LocalDate previousStart) {
        long elapsed = ChronoUnit.DAYS.between(start, end);
        LocalDate previousEnd = previousStart.plusDays(elapsed);
        if (previousEnd.isAfter(start)) {
            previousEnd = start;
        }
        return of(start, end, previousStart, previousEnd);
    }

    private static DeltaPeriods of(LocalDate curStart, LocalDate curEnd, LocalDate prevStart, LocalDate prevEnd) {
        return new DeltaPeriods(DateRange.of(curStart, curEnd), DateRange.of(prevStart, prevEnd));
    }
}
