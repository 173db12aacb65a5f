package org.pivotspec.predicate;

/**
 * UI state of one field's filter.
 * <p>
 * A filter is either a manual multi-select ({@link ManualSelection}) or a rule matching the
 * field's kind: {@link StringRule}, {@link NumberRule} or a {@link DateRule}.
 */
public sealed interface FilterRule permits StringRule, NumberRule, DateRule, ManualSelection {

    /**
     * @param kind declared field kind
     * @return true if this rule can be compiled for a field of that kind
     */
    boolean appliesTo(FieldKind kind);
}
