package org.pivotspec.pivot;

import java.util.Locale;
import java.util.Objects;

/**
 * Sort preference attached to a value assignment.
 *
 * @param by        sort key
 * @param direction sort direction
 */
public record ValueSort(By by, Direction direction) {

    /**
     * What the result is ordered by.
     */
    public enum By {
        X,
        VALUE;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static By fromId(String id) {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Ordering direction.
     */
    public enum Direction {
        ASC,
        DESC;

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Direction fromId(String id) {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        }
    }

    public ValueSort {
        Objects.requireNonNull(by, "by");
        Objects.requireNonNull(direction, "direction");
    }
}
