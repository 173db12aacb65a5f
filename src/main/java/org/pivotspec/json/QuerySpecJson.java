package org.pivotspec.json;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pivotspec.dates.WeekStart;
import org.pivotspec.pivot.Aggregation;
import org.pivotspec.pivot.ConditionalRule;
import org.pivotspec.pivot.SeriesStyle;
import org.pivotspec.pivot.ValueSort;
import org.pivotspec.query.DateGrouping;
import org.pivotspec.query.QuerySpec;
import org.pivotspec.query.SeriesSpec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Maps {@link QuerySpec} to and from the backend's JSON contract.
 * <p>
 * {@code x} and {@code legend} are written as a string when they hold one field and as an array
 * when they hold several. Absent members are omitted rather than written as null.
 */
public final class QuerySpecJson {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private QuerySpecJson() {
        // Utility class
    }

    /**
     * @param spec the spec
     * @return pretty-printed JSON
     */
    public static String toJsonString(QuerySpec spec) {
        return GSON.toJson(toJson(spec));
    }

    /**
     * @param spec the spec
     * @return the JSON tree
     */
    public static JsonObject toJson(QuerySpec spec) {
        JsonObject json = new JsonObject();
        json.addProperty("source", spec.getSource());
        if (spec.getSourceTableId() != null) {
            json.addProperty("sourceTableId", spec.getSourceTableId());
        }
        if (!spec.getSelect().isEmpty()) {
            JsonArray select = new JsonArray();
            spec.getSelect().forEach(select::add);
            json.add("select", select);
        }
        JsonValues.putStringOrArray(json, "x", spec.getX());
        JsonValues.putStringOrArray(json, "legend", spec.getLegend());
        if (!spec.getSeries().isEmpty()) {
            JsonArray series = new JsonArray();
            spec.getSeries().forEach(s -> series.add(seriesToJson(s)));
            json.add("series", series);
        }
        if (spec.getY() != null) {
            json.addProperty("y", spec.getY());
        }
        if (spec.getAgg() != null) {
            json.addProperty("agg", spec.getAgg().id());
        }
        if (spec.getMeasure() != null) {
            json.addProperty("measure", spec.getMeasure());
        }
        json.add("where", GSON.toJsonTree(spec.getWhere()));
        if (spec.getGroupBy() != null) {
            json.addProperty("groupBy", spec.getGroupBy().id());
        }
        if (spec.getWeekStart() != null) {
            json.addProperty("weekStart", spec.getWeekStart().id());
        }
        if (spec.getOrderBy() != null) {
            json.addProperty("orderBy", spec.getOrderBy().id());
        }
        if (spec.getOrder() != null) {
            json.addProperty("order", spec.getOrder().id());
        }
        if (spec.getLimit() != null) {
            json.addProperty("limit", spec.getLimit());
        }
        if (spec.getOffset() != null) {
            json.addProperty("offset", spec.getOffset());
        }
        return json;
    }

    /**
     * @param json JSON text
     * @return the parsed spec
     * @throws JsonParseException if the text is not a valid spec
     */
    public static QuerySpec fromJsonString(String json) {
        JsonElement element = JsonParser.parseString(json);
        if (!element.isJsonObject()) {
            throw new JsonParseException("QuerySpec must be a JSON object");
        }
        return fromJson(element.getAsJsonObject());
    }

    /**
     * @param json the JSON tree
     * @return the parsed spec
     * @throws JsonParseException if the tree is not a valid spec
     */
    public static QuerySpec fromJson(JsonObject json) {
        try {
            QuerySpec.Builder builder = QuerySpec.builder()
                .source(JsonValues.required(json, "source"))
                .sourceTableId(JsonValues.string(json, "sourceTableId"))
                .select(JsonValues.stringOrArray(json, "select"))
                .x(JsonValues.stringOrArray(json, "x"))
                .legend(JsonValues.stringOrArray(json, "legend"))
                .y(JsonValues.string(json, "y"))
                .measure(JsonValues.string(json, "measure"))
                .where(whereFromJson(JsonValues.object(json, "where")))
                .limit(JsonValues.integer(json, "limit"))
                .offset(JsonValues.integer(json, "offset"));

            String agg = JsonValues.string(json, "agg");
            if (agg != null) {
                builder.agg(Aggregation.fromId(agg));
            }
            String groupBy = JsonValues.string(json, "groupBy");
            if (groupBy != null) {
                builder.groupBy(DateGrouping.fromId(groupBy));
            }
            String weekStart = JsonValues.string(json, "weekStart");
            if (weekStart != null) {
                builder.weekStart(WeekStart.fromId(weekStart));
            }
            String orderBy = JsonValues.string(json, "orderBy");
            if (orderBy != null) {
                builder.orderBy(ValueSort.By.fromId(orderBy));
            }
            String order = JsonValues.string(json, "order");
            if (order != null) {
                builder.order(ValueSort.Direction.fromId(order));
            }

            List<SeriesSpec> series = new ArrayList<>();
            JsonArray seriesJson = JsonValues.array(json, "series");
            for (int i = 0; i < seriesJson.size(); i++) {
                series.add(seriesFromJson(seriesJson.get(i).getAsJsonObject(), i));
            }
            return builder.series(series).build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new JsonParseException("Invalid QuerySpec: " + e.getMessage(), e);
        }
    }

    static Map<String, Object> whereFromJson(JsonObject where) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : where.entrySet()) {
            Object value = JsonValues.toJava(entry.getValue());
            if (value != null) {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    private static JsonObject seriesToJson(SeriesSpec series) {
        JsonObject json = new JsonObject();
        json.addProperty("id", series.id());
        if (series.x() != null) {
            json.addProperty("x", series.x());
        }
        if (series.y() != null) {
            json.addProperty("y", series.y());
        }
        if (series.measure() != null) {
            json.addProperty("measure", series.measure());
        }
        json.addProperty("agg", series.agg().id());
        if (series.label() != null) {
            json.addProperty("label", series.label());
        }
        if (series.colorToken() != null) {
            json.addProperty("colorToken", series.colorToken());
        }
        if (series.stackId() != null) {
            json.addProperty("stackId", series.stackId());
        }
        if (series.style() != null) {
            json.addProperty("style", series.style().id());
        }
        if (series.secondaryAxis()) {
            json.addProperty("secondaryAxis", true);
        }
        if (!series.conditionalRules().isEmpty()) {
            json.add("conditionalRules", rulesToJson(series.conditionalRules()));
        }
        return json;
    }

    private static SeriesSpec seriesFromJson(JsonObject json, int index) {
        String id = JsonValues.string(json, "id");
        String agg = JsonValues.string(json, "agg");
        String style = JsonValues.string(json, "style");
        return new SeriesSpec(
            id != null ? id : "s" + index,
            JsonValues.string(json, "x"),
            JsonValues.string(json, "y"),
            JsonValues.string(json, "measure"),
            agg != null ? Aggregation.fromId(agg) : Aggregation.SUM,
            JsonValues.string(json, "label"),
            JsonValues.integer(json, "colorToken"),
            JsonValues.string(json, "stackId"),
            style != null ? SeriesStyle.fromId(style) : null,
            JsonValues.bool(json, "secondaryAxis"),
            rulesFromJson(JsonValues.array(json, "conditionalRules")));
    }

    static JsonArray rulesToJson(List<ConditionalRule> rules) {
        JsonArray array = new JsonArray();
        for (ConditionalRule rule : rules) {
            JsonObject json = new JsonObject();
            json.addProperty("when", rule.when().symbol());
            if (rule.when() == ConditionalRule.Comparison.BETWEEN) {
                JsonArray bounds = new JsonArray();
                bounds.add(plain(rule.value()));
                bounds.add(plain(rule.upper()));
                json.add("value", bounds);
            } else {
                json.addProperty("value", plain(rule.value()));
            }
            if (rule.color() != null) {
                json.addProperty("color", rule.color());
            }
            array.add(json);
        }
        return array;
    }

    static List<ConditionalRule> rulesFromJson(JsonArray array) {
        List<ConditionalRule> rules = new ArrayList<>();
        for (JsonElement element : array) {
            JsonObject json = element.getAsJsonObject();
            String when = JsonValues.required(json, "when");
            ConditionalRule.Comparison comparison = ConditionalRule.Comparison.fromSymbol(when)
                .orElseThrow(() -> new JsonParseException("Unknown rule comparison: " + when));
            JsonElement value = json.get("value");
            if (value == null || value.isJsonNull()) {
                throw new JsonParseException("Conditional rule without value");
            }
            double low;
            Double high = null;
            if (value.isJsonArray()) {
                JsonArray bounds = value.getAsJsonArray();
                low = bounds.get(0).getAsDouble();
                high = bounds.size() > 1 ? bounds.get(1).getAsDouble() : null;
            } else {
                low = value.getAsDouble();
            }
            rules.add(new ConditionalRule(comparison, low, high, JsonValues.string(json, "color")));
        }
        return rules;
    }

    private static Number plain(double value) {
        return JsonValues.toNumber(BigDecimal.valueOf(value));
    }
}
