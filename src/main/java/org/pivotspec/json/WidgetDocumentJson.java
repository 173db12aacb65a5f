package org.pivotspec.json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pivotspec.dates.DeltaMode;
import org.pivotspec.dates.WeekStart;
import org.pivotspec.pivot.Aggregation;
import org.pivotspec.pivot.CustomColumn;
import org.pivotspec.pivot.MeasureDefinition;
import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.pivot.SeriesStyle;
import org.pivotspec.pivot.ValueAssignment;
import org.pivotspec.pivot.ValueSort;
import org.pivotspec.predicate.FieldFilter;
import org.pivotspec.query.DateGrouping;
import org.pivotspec.query.FilterExposure;
import org.pivotspec.query.QuerySpec;
import org.pivotspec.query.WidgetConfig;
import org.pivotspec.query.WidgetOptions;
import org.pivotspec.query.WidgetType;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads widget documents.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * {
 *   "id": "w1",
 *   "type": "kpi",
 *   "source": "sales.orders",
 *   "options": {"deltaMode": "MTD_LMTD", "deltaDateField": "order_date"},
 *   "measures": [{"id": "m1", "name": "Margin", "formula": "SUM(revenue) - SUM(cost)"}],
 *   "filtersExpose": {"order_date": true},
 *   "pivot": {
 *     "x": "region",
 *     "values": [{"field": "revenue", "agg": "sum"}],
 *     "filters": ["order_date"]
 *   },
 *   "filterRules": {"order_date": {"type": "preset", "preset": "today"}},
 *   "querySpec": {"source": "sales.orders", "where": {}}
 * }
 * }</pre>
 */
public final class WidgetDocumentJson {

    private WidgetDocumentJson() {
        // Utility class
    }

    /**
     * @param json JSON text
     * @return the document
     * @throws JsonParseException if the text is not a valid widget document
     */
    public static WidgetDocument fromJsonString(String json) {
        JsonElement element = JsonParser.parseString(json);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Widget document must be a JSON object");
        }
        return fromJson(element.getAsJsonObject());
    }

    /**
     * @param json JSON tree
     * @return the document
     * @throws JsonParseException if the tree is not a valid widget document
     */
    public static WidgetDocument fromJson(JsonObject json) {
        try {
            WidgetType type = WidgetType.fromId(JsonValues.required(json, "type"));
            WidgetConfig widget = new WidgetConfig(
                JsonValues.string(json, "id"),
                JsonValues.required(json, "source"),
                JsonValues.string(json, "sourceTableId"),
                JsonValues.string(json, "datasourceId"),
                options(type, JsonValues.object(json, "options")),
                measures(json),
                customColumns(json),
                exposure(JsonValues.object(json, "filtersExpose")));

            QuerySpec querySpec = json.has("querySpec") && json.get("querySpec").isJsonObject()
                ? QuerySpecJson.fromJson(json.getAsJsonObject("querySpec"))
                : null;

            Map<String, FieldFilter> filterRules = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : JsonValues.object(json, "filterRules").entrySet()) {
                filterRules.put(entry.getKey(), FilterRuleJson.fromJson(entry.getValue().getAsJsonObject()));
            }

            return new WidgetDocument(widget, pivot(JsonValues.object(json, "pivot")), querySpec, filterRules);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new JsonParseException("Invalid widget document: " + e.getMessage(), e);
        }
    }

    private static WidgetOptions options(WidgetType type, JsonObject json) {
        return switch (type) {
            case KPI -> {
                String deltaMode = JsonValues.string(json, "deltaMode");
                String weekStart = JsonValues.string(json, "deltaWeekStart");
                yield new WidgetOptions.Kpi(
                    deltaMode != null ? DeltaMode.fromId(deltaMode) : null,
                    JsonValues.string(json, "deltaDateField"),
                    weekStart != null ? WeekStart.fromId(weekStart) : null);
            }
            case CHART -> {
                String groupBy = JsonValues.string(json, "groupBy");
                String weekStart = JsonValues.string(json, "weekStart");
                yield new WidgetOptions.Chart(
                    JsonValues.string(json, "chartType"),
                    groupBy != null ? DateGrouping.fromId(groupBy) : null,
                    weekStart != null ? WeekStart.fromId(weekStart) : null);
            }
            case DATA_TABLE -> new WidgetOptions.DataTable(JsonValues.integer(json, "pageSize"));
            case PIVOT_TABLE -> new WidgetOptions.PivotTable(
                JsonValues.bool(json, "rowTotals"), JsonValues.bool(json, "columnTotals"));
        };
    }

    private static List<MeasureDefinition> measures(JsonObject json) {
        List<MeasureDefinition> measures = new ArrayList<>();
        for (JsonElement element : JsonValues.array(json, "measures")) {
            JsonObject m = element.getAsJsonObject();
            measures.add(new MeasureDefinition(
                JsonValues.required(m, "id"), JsonValues.string(m, "name"), JsonValues.required(m, "formula")));
        }
        return measures;
    }

    private static List<CustomColumn> customColumns(JsonObject json) {
        List<CustomColumn> columns = new ArrayList<>();
        for (JsonElement element : JsonValues.array(json, "customColumns")) {
            JsonObject c = element.getAsJsonObject();
            columns.add(new CustomColumn(
                JsonValues.string(c, "id"), JsonValues.required(c, "name"),
                JsonValues.required(c, "formula"), JsonValues.string(c, "type")));
        }
        return columns;
    }

    private static FilterExposure exposure(JsonObject json) {
        Map<String, Boolean> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            if (!entry.getValue().isJsonNull()) {
                overrides.put(entry.getKey(), entry.getValue().getAsBoolean());
            }
        }
        return FilterExposure.of(overrides);
    }

    static PivotAssignments pivot(JsonObject json) {
        List<ValueAssignment> values = new ArrayList<>();
        for (JsonElement element : JsonValues.array(json, "values")) {
            values.add(value(element.getAsJsonObject()));
        }
        return new PivotAssignments(
            JsonValues.stringOrArray(json, "x"),
            JsonValues.stringOrArray(json, "legend"),
            values,
            JsonValues.stringOrArray(json, "filters"));
    }

    private static ValueAssignment value(JsonObject json) {
        String agg = JsonValues.string(json, "agg");
        String style = JsonValues.string(json, "style");
        ValueSort sort = null;
        if (json.has("sort") && json.get("sort").isJsonObject()) {
            JsonObject s = json.getAsJsonObject("sort");
            String by = JsonValues.string(s, "by");
            String direction = JsonValues.string(s, "direction");
            sort = new ValueSort(
                by != null ? ValueSort.By.fromId(by) : ValueSort.By.VALUE,
                direction != null ? ValueSort.Direction.fromId(direction) : ValueSort.Direction.DESC);
        }
        return new ValueAssignment(
            JsonValues.string(json, "field"),
            JsonValues.string(json, "measureId"),
            agg != null ? Aggregation.fromId(agg) : Aggregation.COUNT,
            JsonValues.string(json, "label"),
            JsonValues.integer(json, "colorToken"),
            JsonValues.string(json, "stackId"),
            style != null ? SeriesStyle.fromId(style) : null,
            JsonValues.bool(json, "secondaryAxis"),
            sort,
            QuerySpecJson.rulesFromJson(JsonValues.array(json, "conditionalRules")));
    }
}
