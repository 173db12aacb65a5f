package org.pivotspec.pivot;

import java.util.Objects;

/**
 * An edit of {@link PivotAssignments}, applied by {@link PivotReducer}.
 */
public sealed interface PivotPatch {

    /** Appends a field to a zone; duplicates and reserved names are ignored. */
    record AddField(PivotZone zone, String field) implements PivotPatch {
        public AddField {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(field, "field");
        }
    }

    /** Removes a field from a zone. */
    record RemoveField(PivotZone zone, String field) implements PivotPatch {
        public RemoveField {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(field, "field");
        }
    }

    /** Moves a field within a zone; the target index is clamped. */
    record MoveField(PivotZone zone, int from, int to) implements PivotPatch {
        public MoveField {
            Objects.requireNonNull(zone, "zone");
        }
    }

    /** Adds a field value: {@code sum} for numeric fields, {@code count} otherwise. */
    record AddValueField(String field, boolean numeric) implements PivotPatch {
        public AddValueField {
            Objects.requireNonNull(field, "field");
        }
    }

    /** Adds a measure value aggregated with {@code sum} and labelled with the measure name. */
    record AddMeasure(MeasureDefinition measure) implements PivotPatch {
        public AddMeasure {
            Objects.requireNonNull(measure, "measure");
        }
    }

    /** Removes the value at an index. */
    record RemoveValue(int index) implements PivotPatch {
    }

    /** Replaces the value at an index. */
    record ReplaceValue(int index, ValueAssignment value) implements PivotPatch {
        public ReplaceValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /** Moves a value; the target index is clamped. */
    record MoveValue(int from, int to) implements PivotPatch {
    }

    /** Renames a field everywhere it is referenced, e.g. after creating an alias. */
    record RenameField(String from, String to) implements PivotPatch {
        public RenameField {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }
    }

    /** Drops every reference to a field outside the universe. */
    record RetainUniverse(FieldUniverse universe) implements PivotPatch {
        public RetainUniverse {
            Objects.requireNonNull(universe, "universe");
        }
    }
}
