package org.pivotspec.json;

import java.util.ArrayList;
import java.util.List;

import org.pivotspec.dates.CustomRangeOp;
import org.pivotspec.dates.DatePreset;
import org.pivotspec.dates.WeekStart;
import org.pivotspec.predicate.CustomDateRule;
import org.pivotspec.predicate.FieldFilter;
import org.pivotspec.predicate.FieldKind;
import org.pivotspec.predicate.ManualSelection;
import org.pivotspec.predicate.NumberOperator;
import org.pivotspec.predicate.NumberRule;
import org.pivotspec.predicate.PresetDateRule;
import org.pivotspec.predicate.StringOperator;
import org.pivotspec.predicate.StringRule;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads filter rule state from JSON.
 * <p>
 * Accepted shapes:
 * <pre>
 * {"type": "string", "op": "contains", "value": "north, south"}
 * {"type": "number", "op": "between", "a": 10, "b": 20}
 * {"type": "preset", "preset": "this_month", "weekStart": "mon"}
 * {"type": "custom", "op": "between", "a": "2024-01-01", "b": "2024-01-31"}
 * {"type": "manual", "values": ["EU", "US"]}
 * </pre>
 * An optional {@code kind} member overrides the kind implied by the type.
 */
public final class FilterRuleJson {

    private FilterRuleJson() {
        // Utility class
    }

    public static FieldFilter fromJsonString(String json) {
        JsonElement element = JsonParser.parseString(json);
        if (!element.isJsonObject()) {
            throw new JsonParseException("Filter rule must be a JSON object");
        }
        return fromJson(element.getAsJsonObject());
    }

    public static FieldFilter fromJson(JsonObject json) {
        String type = JsonValues.required(json, "type");
        try {
            FieldFilter parsed = switch (type) {
                case "string" -> new FieldFilter(FieldKind.STRING, new StringRule(
                    stringOperator(JsonValues.required(json, "op")), JsonValues.string(json, "value")));
                case "number" -> new FieldFilter(FieldKind.NUMBER, new NumberRule(
                    numberOperator(JsonValues.required(json, "op")),
                    JsonValues.number(json, "a"), JsonValues.number(json, "b")));
                case "preset" -> new FieldFilter(FieldKind.DATE, presetRule(json));
                case "custom" -> new FieldFilter(FieldKind.DATE, customRule(json));
                case "manual" -> new FieldFilter(FieldKind.STRING, manualSelection(json));
                default -> throw new JsonParseException("Unknown filter rule type: " + type);
            };
            String kind = JsonValues.string(json, "kind");
            return kind != null ? new FieldFilter(FieldKind.fromId(kind), parsed.rule()) : parsed;
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Invalid filter rule: " + e.getMessage(), e);
        }
    }

    private static PresetDateRule presetRule(JsonObject json) {
        String preset = JsonValues.required(json, "preset");
        return new PresetDateRule(
            DatePreset.fromId(preset).orElseThrow(() -> new JsonParseException("Unknown preset: " + preset)),
            WeekStart.fromId(JsonValues.string(json, "weekStart")));
    }

    private static CustomDateRule customRule(JsonObject json) {
        String op = JsonValues.required(json, "op");
        return new CustomDateRule(
            CustomRangeOp.fromId(op).orElseThrow(() -> new JsonParseException("Unknown date operator: " + op)),
            JsonValues.string(json, "a"), JsonValues.string(json, "b"));
    }

    private static ManualSelection manualSelection(JsonObject json) {
        List<Object> values = new ArrayList<>();
        for (JsonElement item : JsonValues.array(json, "values")) {
            values.add(JsonValues.toJava(item));
        }
        return new ManualSelection(values);
    }

    private static StringOperator stringOperator(String op) {
        return StringOperator.fromId(op).orElseThrow(() -> new JsonParseException("Unknown string operator: " + op));
    }

    private static NumberOperator numberOperator(String op) {
        return NumberOperator.fromId(op).orElseThrow(() -> new JsonParseException("Unknown number operator: " + op));
    }
}
