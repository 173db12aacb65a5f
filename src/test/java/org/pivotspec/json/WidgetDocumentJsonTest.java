package org.pivotspec.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotspec.dates.CustomRangeOp;
import org.pivotspec.dates.DatePreset;
import org.pivotspec.dates.DeltaMode;
import org.pivotspec.dates.WeekStart;
import org.pivotspec.pivot.Aggregation;
import org.pivotspec.pivot.ValueSort;
import org.pivotspec.predicate.CustomDateRule;
import org.pivotspec.predicate.FieldFilter;
import org.pivotspec.predicate.FieldKind;
import org.pivotspec.predicate.ManualSelection;
import org.pivotspec.predicate.NumberOperator;
import org.pivotspec.predicate.NumberRule;
import org.pivotspec.predicate.PresetDateRule;
import org.pivotspec.predicate.StringOperator;
import org.pivotspec.predicate.StringRule;
import org.pivotspec.query.WidgetOptions;
import org.pivotspec.query.WidgetType;

import com.google.gson.JsonParseException;

@Tag("unit")
@DisplayName("Widget document JSON")
class WidgetDocumentJsonTest {

    private static final String KPI_DOCUMENT = """
        {
          "id": "w1",
          "type": "kpi",
          "source": "sales.orders",
          "datasourceId": "ds-1",
          "options": {"deltaMode": "MTD_LMTD", "deltaDateField": "order_date", "deltaWeekStart": "sun"},
          "measures": [{"id": "m1", "name": "Margin", "formula": "SUM(revenue) - SUM(cost)"}],
          "filtersExpose": {"order_date": true, "region": false},
          "pivot": {
            "x": "region",
            "values": [{"field": "revenue", "agg": "sum", "colorToken": 2, "sort": {"direction": "asc"}}],
            "filters": ["order_date"]
          },
          "filterRules": {"order_date": {"type": "preset", "preset": "today"}},
          "querySpec": {"source": "sales.orders", "y": "revenue", "agg": "sum", "where": {}}
        }
        """;

    // ==================== Widget documents ====================

    @Nested
    @DisplayName("Widget documents")
    class Documents {

        @Test
        @DisplayName("Reads widget, pivot, persisted spec and filter rules")
        void readsKpiDocument() {
            WidgetDocument document = WidgetDocumentJson.fromJsonString(KPI_DOCUMENT);

            assertThat(document.widget().id()).isEqualTo("w1");
            assertThat(document.widget().type()).isEqualTo(WidgetType.KPI);
            assertThat(document.widget().datasourceId()).isEqualTo("ds-1");
            assertThat(document.widget().options())
                .isEqualTo(new WidgetOptions.Kpi(DeltaMode.MTD_LMTD, "order_date", WeekStart.SUN));
            assertThat(document.widget().measure("m1")).isPresent();
            assertThat(document.widget().filtersExpose().isExposed("order_date")).isTrue();
            assertThat(document.widget().filtersExpose().isExposed("region")).isFalse();

            assertThat(document.pivot().x()).containsExactly("region");
            assertThat(document.pivot().filters()).containsExactly("order_date");
            assertThat(document.pivot().values().get(0).agg()).isEqualTo(Aggregation.SUM);
            assertThat(document.pivot().values().get(0).colorToken()).isEqualTo(2);
            assertThat(document.pivot().values().get(0).sort())
                .isEqualTo(new ValueSort(ValueSort.By.VALUE, ValueSort.Direction.ASC));

            assertThat(document.querySpec().getY()).isEqualTo("revenue");
            assertThat(document.filterRules().get("order_date").rule())
                .isEqualTo(PresetDateRule.of(DatePreset.TODAY));
        }

        @Test
        @DisplayName("Missing persisted spec and pivot default to empty")
        void minimalDocument() {
            WidgetDocument document = WidgetDocumentJson.fromJsonString(
                "{\"type\": \"table\", \"source\": \"t\", \"options\": {\"pageSize\": 50}}");

            assertThat(document.querySpec()).isNull();
            assertThat(document.pivot().values()).isEmpty();
            assertThat(document.widget().options()).isEqualTo(new WidgetOptions.DataTable(50));
        }

        @Test
        @DisplayName("Unknown widget types are rejected")
        void unknownType() {
            assertThatThrownBy(() -> WidgetDocumentJson.fromJsonString("{\"type\": \"gauge\", \"source\": \"t\"}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("gauge");
        }

        @Test
        @DisplayName("Values referencing both a field and a measure are rejected")
        void invalidValue() {
            String json = "{\"type\": \"chart\", \"source\": \"t\","
                + " \"pivot\": {\"values\": [{\"field\": \"a\", \"measureId\": \"m\"}]}}";

            assertThatThrownBy(() -> WidgetDocumentJson.fromJsonString(json)).isInstanceOf(JsonParseException.class);
        }
    }

    // ==================== Filter rules ====================

    @Nested
    @DisplayName("Filter rules")
    class FilterRules {

        @Test
        @DisplayName("Reads every rule type")
        void readsRuleTypes() {
            assertThat(FilterRuleJson.fromJsonString("{\"type\":\"string\",\"op\":\"contains\",\"value\":\"a, b\"}"))
                .isEqualTo(new FieldFilter(FieldKind.STRING, new StringRule(StringOperator.CONTAINS, "a, b")));
            assertThat(FilterRuleJson.fromJsonString("{\"type\":\"number\",\"op\":\"between\",\"a\":10,\"b\":\"20\"}"))
                .isEqualTo(new FieldFilter(FieldKind.NUMBER, NumberRule.between(10L, 20L)));
            assertThat(FilterRuleJson.fromJsonString(
                "{\"type\":\"custom\",\"op\":\"after\",\"a\":\"2024-01-01\"}"))
                .isEqualTo(new FieldFilter(FieldKind.DATE,
                    new CustomDateRule(CustomRangeOp.AFTER, "2024-01-01", null)));
            assertThat(FilterRuleJson.fromJsonString("{\"type\":\"manual\",\"values\":[\"EU\",3]}").rule())
                .isEqualTo(new ManualSelection(List.of("EU", 3L)));
        }

        @Test
        @DisplayName("An explicit kind overrides the implied one")
        void kindOverride() {
            FieldFilter filter = FilterRuleJson.fromJsonString(
                "{\"type\":\"manual\",\"kind\":\"number\",\"values\":[1,2]}");

            assertThat(filter.kind()).isEqualTo(FieldKind.NUMBER);
        }

        @Test
        @DisplayName("Unknown operators and presets are rejected")
        void rejectsUnknown() {
            assertThatThrownBy(() -> FilterRuleJson.fromJsonString("{\"type\":\"number\",\"op\":\"near\"}"))
                .isInstanceOf(JsonParseException.class);
            assertThatThrownBy(() -> FilterRuleJson.fromJsonString("{\"type\":\"preset\",\"preset\":\"someday\"}"))
                .isInstanceOf(JsonParseException.class);
            assertThatThrownBy(() -> FilterRuleJson.fromJsonString("{\"type\":\"regex\"}"))
                .isInstanceOf(JsonParseException.class);
        }
    }
}
