package org.pivotspec.predicate;

/**
 * Date filter: a named preset or a custom range.
 */
public sealed interface DateRule extends FilterRule permits PresetDateRule, CustomDateRule {

    @Override
    default boolean appliesTo(FieldKind kind) {
        return kind == FieldKind.DATE;
    }
}
