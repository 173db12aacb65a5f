package org.pivotspec.dates;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A synthetic field computed from a base date field, named {@code "<base> (<Part>)"}.
 * <p>
 * Example: {@code "OrderDate (Month)"} derives the month number from {@code OrderDate}.
 *
 * @param baseField the underlying date field
 * @param part      the calendar part to derive
 */
public record DerivedDateField(String baseField, DatePart part) {

    private static final Pattern NAME = Pattern.compile(
        "^(.*) \\((Year|Quarter|Month|Month Name|Month Short|Week|Day|Day Name|Day Short)\\)$");

    public DerivedDateField {
        Objects.requireNonNull(baseField, "baseField");
        Objects.requireNonNull(part, "part");
    }

    /**
     * Parses a derived field name.
     *
     * @param fieldName candidate name
     * @return the derived field, or empty if the name does not follow the derived pattern
     */
    public static Optional<DerivedDateField> parse(String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        Matcher m = NAME.matcher(fieldName);
        if (!m.matches() || m.group(1).isBlank()) {
            return Optional.empty();
        }
        return DatePart.fromLabel(m.group(2)).map(part -> new DerivedDateField(m.group(1), part));
    }

    /**
     * @param fieldName candidate name
     * @return true if the name denotes a derived date-part field
     */
    public static boolean isDerived(String fieldName) {
        return parse(fieldName).isPresent();
    }

    /**
     * @return the synthetic field name
     */
    public String name() {
        return baseField + " (" + part.label() + ")";
    }

    /**
     * Derives the part value from a raw base value.
     *
     * @param rawValue  base field value in any encoding {@link FlexibleDateParser} accepts
     * @param weekStart week start for {@link DatePart#WEEK}
     * @return the derived value, or null when the raw value is not a date
     */
    public Object derive(Object rawValue, WeekStart weekStart) {
        LocalDate date = FlexibleDateParser.parseDate(rawValue);
        return date != null ? part.extract(date, weekStart) : null;
    }
}
