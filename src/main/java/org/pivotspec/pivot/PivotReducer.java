package org.pivotspec.pivot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Applies {@link PivotPatch} edits to {@link PivotAssignments}, always returning a new value.
 * <p>
 * Patches that would not change anything (adding a duplicate, removing an absent field,
 * out-of-range indexes) return the input state unchanged.
 */
public final class PivotReducer {

    /** Names that never become dimensions: the long-format value column and metric marker. */
    public static final Set<String> RESERVED_FIELDS = Set.of("value", "__metric__");

    private PivotReducer() {
        // Utility class
    }

    /**
     * Applies a patch.
     *
     * @param state current assignments
     * @param patch the edit
     * @return the new assignments
     */
    public static PivotAssignments reduce(PivotAssignments state, PivotPatch patch) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(patch, "patch");

        if (patch instanceof PivotPatch.AddField p) {
            return addField(state, p.zone(), p.field());
        } else if (patch instanceof PivotPatch.RemoveField p) {
            List<String> fields = state.mutableFields(p.zone());
            return fields.remove(p.field()) ? state.withFields(p.zone(), fields) : state;
        } else if (patch instanceof PivotPatch.MoveField p) {
            List<String> moved = move(state.fields(p.zone()), p.from(), p.to());
            return moved == null ? state : state.withFields(p.zone(), moved);
        } else if (patch instanceof PivotPatch.AddValueField p) {
            return addValueField(state, p.field(), p.numeric());
        } else if (patch instanceof PivotPatch.AddMeasure p) {
            return addMeasure(state, p.measure());
        } else if (patch instanceof PivotPatch.RemoveValue p) {
            if (p.index() < 0 || p.index() >= state.values().size()) {
                return state;
            }
            List<ValueAssignment> values = new ArrayList<>(state.values());
            values.remove(p.index());
            return state.withValues(values);
        } else if (patch instanceof PivotPatch.ReplaceValue p) {
            if (p.index() < 0 || p.index() >= state.values().size()) {
                return state;
            }
            List<ValueAssignment> values = new ArrayList<>(state.values());
            values.set(p.index(), p.value());
            return state.withValues(values);
        } else if (patch instanceof PivotPatch.MoveValue p) {
            List<ValueAssignment> moved = move(state.values(), p.from(), p.to());
            return moved == null ? state : state.withValues(moved);
        } else if (patch instanceof PivotPatch.RenameField p) {
            return rename(state, p.from(), p.to());
        } else if (patch instanceof PivotPatch.RetainUniverse p) {
            return retain(state, p.universe());
        }
        throw new IllegalArgumentException("Unsupported patch: " + patch);
    }

    /**
     * Applies patches in order.
     *
     * @param state   current assignments
     * @param patches edits
     * @return the new assignments
     */
    public static PivotAssignments reduceAll(PivotAssignments state, List<? extends PivotPatch> patches) {
        PivotAssignments current = state;
        for (PivotPatch patch : patches) {
            current = reduce(current, patch);
        }
        return current;
    }

    private static PivotAssignments addField(PivotAssignments state, PivotZone zone, String field) {
        if (zone != PivotZone.FILTERS && RESERVED_FIELDS.contains(field.toLowerCase(Locale.ROOT))) {
            return state;
        }
        List<String> fields = state.mutableFields(zone);
        if (fields.contains(field)) {
            return state;
        }
        fields.add(field);
        return state.withFields(zone, fields);
    }

    private static PivotAssignments addValueField(PivotAssignments state, String field, boolean numeric) {
        for (ValueAssignment value : state.values()) {
            if (field.equals(value.field())) {
                return state;
            }
        }
        List<ValueAssignment> values = new ArrayList<>(state.values());
        values.add(ValueAssignment.ofField(field, numeric ? Aggregation.SUM : Aggregation.COUNT));
        return state.withValues(values);
    }

    private static PivotAssignments addMeasure(PivotAssignments state, MeasureDefinition measure) {
        for (ValueAssignment value : state.values()) {
            if (measure.id().equals(value.measureId())) {
                return state;
            }
        }
        List<ValueAssignment> values = new ArrayList<>(state.values());
        values.add(ValueAssignment.ofMeasure(measure.id(), Aggregation.SUM).withLabel(measure.name()));
        return state.withValues(values);
    }

    private static PivotAssignments rename(PivotAssignments state, String from, String to) {
        if (from.equals(to)) {
            return state;
        }
        // Field values stay unique by field, as when they are added; the first occurrence wins.
        List<ValueAssignment> values = new ArrayList<>();
        Set<String> seenFields = new HashSet<>();
        for (ValueAssignment value : state.values()) {
            ValueAssignment renamed = from.equals(value.field()) ? value.withField(to) : value;
            if (renamed.isMeasure() || seenFields.add(renamed.field())) {
                values.add(renamed);
            }
        }
        return new PivotAssignments(
            replace(state.x(), from, to),
            replace(state.legend(), from, to),
            values,
            replace(state.filters(), from, to));
    }

    private static PivotAssignments retain(PivotAssignments state, FieldUniverse universe) {
        List<ValueAssignment> values = new ArrayList<>();
        for (ValueAssignment value : state.values()) {
            if (value.isMeasure() || universe.contains(value.field())) {
                values.add(value);
            }
        }
        return new PivotAssignments(
            keep(state.x(), universe),
            keep(state.legend(), universe),
            values,
            keep(state.filters(), universe));
    }

    private static List<String> replace(List<String> fields, String from, String to) {
        List<String> result = new ArrayList<>();
        for (String field : fields) {
            String renamed = field.equals(from) ? to : field;
            if (!result.contains(renamed)) {
                result.add(renamed);
            }
        }
        return result;
    }

    private static List<String> keep(List<String> fields, FieldUniverse universe) {
        List<String> result = new ArrayList<>();
        for (String field : fields) {
            if (universe.contains(field)) {
                result.add(field);
            }
        }
        return result;
    }

    private static <T> List<T> move(List<T> items, int from, int to) {
        if (from < 0 || from >= items.size()) {
            return null;
        }
        int target = Math.max(0, Math.min(to, items.size() - 1));
        if (target == from) {
            return null;
        }
        List<T> result = new ArrayList<>(items);
        T item = result.remove(from);
        result.add(target, item);
        return result;
    }
}
