package org.pivotspec.dates;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * Calendar parts that can be derived from a date field.
 * <p>
 * The label is the text used in derived field names, e.g. {@code "OrderDate (Month Name)"}.
 * Numeric parts yield {@link Integer} values, named parts yield English {@link String} values.
 */
public enum DatePart {
    YEAR("Year", true),
    QUARTER("Quarter", true),
    MONTH("Month", true),
    MONTH_NAME("Month Name", false),
    MONTH_SHORT("Month Short", false),
    WEEK("Week", true),
    DAY("Day", true),
    DAY_NAME("Day Name", false),
    DAY_SHORT("Day Short", false);

    private final String label;
    private final boolean numeric;

    DatePart(String label, boolean numeric) {
        this.label = label;
        this.numeric = numeric;
    }

    public String label() {
        return label;
    }

    /**
     * @return true if {@link #extract(LocalDate)} yields a number
     */
    public boolean isNumeric() {
        return numeric;
    }

    /**
     * Extracts this part using ISO week numbering.
     *
     * @param date the date
     * @return the part value
     */
    public Object extract(LocalDate date) {
        return extract(date, WeekStart.MON);
    }

    /**
     * Extracts this part.
     *
     * @param date      the date
     * @param weekStart week start used by {@link #WEEK}
     * @return the part value
     */
    public Object extract(LocalDate date, WeekStart weekStart) {
        return switch (this) {
            case YEAR -> date.getYear();
            case QUARTER -> (date.getMonthValue() - 1) / 3 + 1;
            case MONTH -> date.getMonthValue();
            case MONTH_NAME -> date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            case MONTH_SHORT -> date.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            case WEEK -> WeekNumbers.weekNumber(date, weekStart);
            case DAY -> date.getDayOfMonth();
            case DAY_NAME -> date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            case DAY_SHORT -> date.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
        };
    }

    /**
     * Looks up a part by its label.
     *
     * @param label label as it appears in derived field names
     * @return the part, or empty if no part has that label
     */
    public static Optional<DatePart> fromLabel(String label) {
        for (DatePart part : values()) {
            if (part.label.equals(label)) {
                return Optional.of(part);
            }
        }
        return Optional.empty();
    }
}
