package org.pivotspec.predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Manual multi-select: the literal values the user ticked in the picker.
 *
 * @param values chosen values in selection order; empty clears the filter
 */
public record ManualSelection(List<Object> values) implements FilterRule {

    public ManualSelection {
        values = values == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ManualSelection of(Object... values) {
        List<Object> list = new ArrayList<>();
        Collections.addAll(list, values);
        return new ManualSelection(list);
    }

    @Override
    public boolean appliesTo(FieldKind kind) {
        return true;
    }
}
