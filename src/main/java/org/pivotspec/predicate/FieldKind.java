package org.pivotspec.predicate;

import java.util.Locale;

/**
 * Declared kind of a filterable field, selecting which rule editor and predicate shapes apply.
 */
public enum FieldKind {
    STRING,
    NUMBER,
    DATE;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id {@code string}, {@code number} or {@code date}, case-insensitive
     * @return the kind
     * @throws IllegalArgumentException if unknown
     */
    public static FieldKind fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
