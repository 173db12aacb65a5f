package org.pivotspec.pivot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("PivotReducer")
class PivotReducerTest {

    private static final PivotAssignments BASE = new PivotAssignments(
        List.of("region", "country"),
        List.of("channel"),
        List.of(ValueAssignment.ofField("revenue", Aggregation.SUM)),
        List.of("order_date"));

    // ==================== Dimension zones ====================

    @Nested
    @DisplayName("Dimension zones")
    class Zones {

        @Test
        @DisplayName("Adding a field appends it to the zone")
        void addField() {
            PivotAssignments next = PivotReducer.reduce(BASE, new PivotPatch.AddField(PivotZone.LEGEND, "segment"));

            assertThat(next.legend()).containsExactly("channel", "segment");
            assertThat(next.x()).isEqualTo(BASE.x());
            assertThat(BASE.legend()).containsExactly("channel");
        }

        @Test
        @DisplayName("Adding a duplicate returns the same state")
        void addDuplicate() {
            assertThat(PivotReducer.reduce(BASE, new PivotPatch.AddField(PivotZone.X, "region"))).isSameAs(BASE);
        }

        @Test
        @DisplayName("Reserved names never become dimensions but may be filters")
        void reservedNames() {
            assertThat(PivotReducer.reduce(BASE, new PivotPatch.AddField(PivotZone.X, "Value"))).isSameAs(BASE);
            assertThat(PivotReducer.reduce(BASE, new PivotPatch.AddField(PivotZone.LEGEND, "__metric__")))
                .isSameAs(BASE);

            PivotAssignments next = PivotReducer.reduce(BASE, new PivotPatch.AddField(PivotZone.FILTERS, "value"));
            assertThat(next.filters()).containsExactly("order_date", "value");
        }

        @Test
        @DisplayName("Removing an absent field is a no-op")
        void removeField() {
            PivotAssignments next = PivotReducer.reduce(BASE, new PivotPatch.RemoveField(PivotZone.X, "region"));

            assertThat(next.x()).containsExactly("country");
            assertThat(PivotReducer.reduce(BASE, new PivotPatch.RemoveField(PivotZone.X, "missing"))).isSameAs(BASE);
        }

        @Test
        @DisplayName("Moving clamps the target index")
        void moveField() {
            PivotAssignments state = BASE.withFields(PivotZone.X, List.of("a", "b", "c"));

            assertThat(PivotReducer.reduce(state, new PivotPatch.MoveField(PivotZone.X, 0, 10)).x())
                .containsExactly("b", "c", "a");
            assertThat(PivotReducer.reduce(state, new PivotPatch.MoveField(PivotZone.X, 2, -3)).x())
                .containsExactly("c", "a", "b");
            assertThat(PivotReducer.reduce(state, new PivotPatch.MoveField(PivotZone.X, 1, 1))).isSameAs(state);
            assertThat(PivotReducer.reduce(state, new PivotPatch.MoveField(PivotZone.X, 5, 0))).isSameAs(state);
        }
    }

    // ==================== Values zone ====================

    @Nested
    @DisplayName("Values zone")
    class Values {

        @Test
        @DisplayName("Numeric fields default to SUM, others to COUNT")
        void defaultAggregation() {
            PivotAssignments next = PivotReducer.reduceAll(PivotAssignments.empty(), List.of(
                new PivotPatch.AddValueField("amount", true),
                new PivotPatch.AddValueField("customer", false)));

            assertThat(next.values()).extracting(ValueAssignment::field, ValueAssignment::agg)
                .containsExactly(
                    tuple("amount", Aggregation.SUM),
                    tuple("customer", Aggregation.COUNT));
        }

        @Test
        @DisplayName("A field is added to values once")
        void valueFieldDeduplicated() {
            assertThat(PivotReducer.reduce(BASE, new PivotPatch.AddValueField("revenue", true))).isSameAs(BASE);
        }

        @Test
        @DisplayName("Measures are added with SUM and their name as label")
        void addMeasure() {
            MeasureDefinition margin = new MeasureDefinition("m1", "Margin", "SUM(revenue) - SUM(cost)");

            PivotAssignments next = PivotReducer.reduce(BASE, new PivotPatch.AddMeasure(margin));

            ValueAssignment added = next.values().get(1);
            assertThat(added.measureId()).isEqualTo("m1");
            assertThat(added.agg()).isEqualTo(Aggregation.SUM);
            assertThat(added.label()).isEqualTo("Margin");
            assertThat(PivotReducer.reduce(next, new PivotPatch.AddMeasure(margin))).isSameAs(next);
        }

        @Test
        @DisplayName("Out-of-range value indexes are ignored")
        void outOfRange() {
            assertThat(PivotReducer.reduce(BASE, new PivotPatch.RemoveValue(3))).isSameAs(BASE);
            assertThat(PivotReducer.reduce(BASE,
                new PivotPatch.ReplaceValue(-1, ValueAssignment.ofField("cost", Aggregation.AVG)))).isSameAs(BASE);
        }

        @Test
        @DisplayName("Replace and remove operate on the indexed value")
        void replaceAndRemove() {
            PivotAssignments replaced = PivotReducer.reduce(BASE,
                new PivotPatch.ReplaceValue(0, ValueAssignment.ofField("revenue", Aggregation.AVG)));

            assertThat(replaced.values().get(0).agg()).isEqualTo(Aggregation.AVG);
            assertThat(PivotReducer.reduce(replaced, new PivotPatch.RemoveValue(0)).values()).isEmpty();
        }

        @Test
        @DisplayName("Values can be reordered")
        void moveValue() {
            PivotAssignments state = PivotReducer.reduce(BASE, new PivotPatch.AddValueField("cost", true));

            PivotAssignments next = PivotReducer.reduce(state, new PivotPatch.MoveValue(1, 0));

            assertThat(next.values()).extracting(ValueAssignment::field).containsExactly("cost", "revenue");
        }
    }

    // ==================== Schema changes ====================

    @Nested
    @DisplayName("Schema changes")
    class SchemaChanges {

        @Test
        @DisplayName("Rename updates every zone and de-duplicates")
        void rename() {
            PivotAssignments state = new PivotAssignments(
                List.of("old", "new"),
                List.of("old"),
                List.of(ValueAssignment.ofField("old", Aggregation.COUNT)),
                List.of("old"));

            PivotAssignments next = PivotReducer.reduce(state, new PivotPatch.RenameField("old", "new"));

            assertThat(next.x()).containsExactly("new");
            assertThat(next.legend()).containsExactly("new");
            assertThat(next.filters()).containsExactly("new");
            assertThat(next.values().get(0).field()).isEqualTo("new");
        }

        @Test
        @DisplayName("Rename keeps field values unique")
        void renameDeduplicatesValues() {
            PivotAssignments state = new PivotAssignments(List.of(), List.of(),
                List.of(
                    ValueAssignment.ofField("amount", Aggregation.SUM),
                    ValueAssignment.ofField("revenue", Aggregation.AVG),
                    ValueAssignment.ofMeasure("m1", Aggregation.SUM)),
                List.of());

            PivotAssignments next = PivotReducer.reduce(state, new PivotPatch.RenameField("revenue", "amount"));

            assertThat(next.values())
                .extracting(ValueAssignment::field, ValueAssignment::agg)
                .containsExactly(tuple("amount", Aggregation.SUM), tuple(null, Aggregation.SUM));
        }

        @Test
        @DisplayName("Retain drops unknown fields but keeps measures and derived fields")
        void retain() {
            PivotAssignments state = new PivotAssignments(
                List.of("order_date (Month)", "gone"),
                List.of("region"),
                List.of(ValueAssignment.ofField("gone", Aggregation.SUM),
                    ValueAssignment.ofMeasure("m1", Aggregation.SUM)),
                List.of("region", "gone"));
            FieldUniverse universe = FieldUniverse.ofFields(List.of("order_date", "region"));

            PivotAssignments next = PivotReducer.reduce(state, new PivotPatch.RetainUniverse(universe));

            assertThat(next.x()).containsExactly("order_date (Month)");
            assertThat(next.legend()).containsExactly("region");
            assertThat(next.filters()).containsExactly("region");
            assertThat(next.values()).extracting(ValueAssignment::measureId).containsExactly("m1");
        }
    }
}
