package org.pivotspec.predicate;

import java.util.Objects;

import org.pivotspec.dates.CustomRangeOp;

/**
 * Date filter with explicit, end-inclusive bounds as typed by the user.
 *
 * @param operator after, before or between
 * @param a        first date input, may be null
 * @param b        second date input, may be null
 */
public record CustomDateRule(CustomRangeOp operator, String a, String b) implements DateRule {

    public CustomDateRule {
        Objects.requireNonNull(operator, "operator");
    }
}
