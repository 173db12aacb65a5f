package org.pivotspec.predicate;

import java.util.Objects;

/**
 * A field's declared kind together with its current filter state.
 *
 * @param kind declared kind
 * @param rule filter state
 */
public record FieldFilter(FieldKind kind, FilterRule rule) {

    public FieldFilter {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(rule, "rule");
    }
}
