package org.pivotspec.dates;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.Date;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the heterogeneous date encodings found in analytics sources.
 * <p>
 * Accepted string forms, in order of attempt:
 * <ol>
 *   <li>Epoch seconds or milliseconds: 10 to 13 digits (exactly 10 digits are seconds)</li>
 *   <li>{@code YYYY-MM-DD} optionally followed by {@code [ T]HH:MM[:SS]}</li>
 *   <li>{@code MM/DD/YYYY} optionally followed by {@code HH:MM[:SS]}</li>
 *   <li>Bare {@code YYYY-MM} (first of the month)</li>
 *   <li>{@code MMM-YYYY} or {@code MMMM YYYY}, e.g. {@code Jan-2024}, {@code January 2024}</li>
 * </ol>
 * <p>
 * Parsing never throws. Unrecognized text and invalid calendar values (month 13, February 30)
 * yield {@code null}, which callers treat as "exclude from computation".
 */
public final class FlexibleDateParser {

    private static final Pattern EPOCH = Pattern.compile("^\\d{10,13}$");
    private static final Pattern ISO = Pattern.compile(
        "^(\\d{4})-(\\d{2})-(\\d{2})(?:[ T](\\d{2}):(\\d{2})(?::(\\d{2})(?:\\.\\d{1,9})?)?(?:Z|[+-]\\d{2}:?\\d{2})?)?$");
    private static final Pattern US = Pattern.compile(
        "^([0-1]?\\d)/([0-3]?\\d)/(\\d{4})(?:\\s+(\\d{2}):(\\d{2})(?::(\\d{2}))?)?$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})-(\\d{1,2})$");
    private static final Pattern MONTH_YEAR = Pattern.compile("^([A-Za-z]{3,9})[- ](\\d{4})$");

    private static final Map<String, Month> MONTH_NAMES = new HashMap<>();

    static {
        for (Month month : Month.values()) {
            MONTH_NAMES.put(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
            MONTH_NAMES.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
        }
        // Common alternative abbreviation
        MONTH_NAMES.put("sept", Month.SEPTEMBER);
    }

    private FlexibleDateParser() {
        // Utility class
    }

    /**
     * Parses a value using UTC for epoch conversion.
     *
     * @param value String, number, {@code java.time} value or {@link Date}; may be null
     * @return the local date-time, or null if the value is not a recognizable date
     */
    public static LocalDateTime parse(Object value) {
        return parse(value, ZoneOffset.UTC);
    }

    /**
     * Parses a value, converting epoch and instant inputs into the given zone.
     *
     * @param value String, number, {@code java.time} value or {@link Date}; may be null
     * @param zone  zone used for epoch and instant inputs
     * @return the local date-time, or null if the value is not a recognizable date
     */
    public static LocalDateTime parse(Object value, ZoneId zone) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, zone);
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.withZoneSameInstant(zone).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.atZoneSameInstant(zone).toLocalDateTime();
        }
        if (value instanceof Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), zone);
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d != Math.rint(d)) {
                return null;
            }
            return parseText(Long.toString(number.longValue()), zone);
        }
        return parseText(value.toString().trim(), zone);
    }

    /**
     * Parses a value and truncates it to its calendar date.
     *
     * @param value see {@link #parse(Object)}
     * @return the date, or null if the value is not a recognizable date
     */
    public static LocalDate parseDate(Object value) {
        LocalDateTime parsed = parse(value);
        return parsed != null ? parsed.toLocalDate() : null;
    }

    private static LocalDateTime parseText(String s, ZoneId zone) {
        if (s.isEmpty()) {
            return null;
        }

        if (EPOCH.matcher(s).matches()) {
            long n = Long.parseLong(s);
            long millis = s.length() == 10 ? n * 1000L : n;
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), zone);
        }

        Matcher m = ISO.matcher(s);
        if (m.matches()) {
            return build(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3)),
                m.group(4), m.group(5), m.group(6));
        }

        m = US.matcher(s);
        if (m.matches()) {
            return build(toInt(m.group(3)), toInt(m.group(1)), toInt(m.group(2)),
                m.group(4), m.group(5), m.group(6));
        }

        m = YEAR_MONTH.matcher(s);
        if (m.matches()) {
            return build(toInt(m.group(1)), toInt(m.group(2)), 1, null, null, null);
        }

        m = MONTH_YEAR.matcher(s);
        if (m.matches()) {
            Month month = MONTH_NAMES.get(m.group(1).toLowerCase(Locale.ROOT));
            if (month == null) {
                return null;
            }
            return build(toInt(m.group(2)), month.getValue(), 1, null, null, null);
        }

        return null;
    }

    private static LocalDateTime build(int year, int month, int day, String hh, String mm, String ss) {
        try {
            int hour = hh != null ? toInt(hh) : 0;
            int minute = mm != null ? toInt(mm) : 0;
            int second = ss != null ? toInt(ss) : 0;
            return LocalDateTime.of(year, month, day, hour, minute, second);
        } catch (DateTimeException e) {
            // Out-of-range calendar values are "not a date"
            return null;
        }
    }

    private static int toInt(String digits) {
        return Integer.parseInt(digits);
    }
}
