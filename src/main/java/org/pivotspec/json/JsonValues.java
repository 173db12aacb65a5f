package org.pivotspec.json;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

/**
 * Conversions between Gson trees and plain Java values.
 */
final class JsonValues {

    private JsonValues() {
        // Utility class
    }

    /**
     * Converts a JSON element into String, Long, Double, Boolean, List or Map values.
     * Integral numbers become {@link Long}, others {@link Double}.
     */
    static Object toJava(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(toJava(item));
            }
            return list;
        }
        if (element.isJsonObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                map.put(entry.getKey(), toJava(entry.getValue()));
            }
            return map;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return toNumber(primitive.getAsBigDecimal());
        }
        return primitive.getAsString();
    }

    static Number toNumber(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) {
            return stripped.longValueExact();
        }
        return value.doubleValue();
    }

    /**
     * Reads a member that may be a string, an array of strings or absent.
     */
    static List<String> stringOrArray(JsonObject object, String member) {
        List<String> result = new ArrayList<>();
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) {
            return result;
        }
        if (element.isJsonArray()) {
            for (JsonElement item : element.getAsJsonArray()) {
                if (!item.isJsonNull()) {
                    result.add(item.getAsString());
                }
            }
        } else {
            String value = element.getAsString();
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }

    /**
     * Writes a list as absent (empty), a string (one element) or an array.
     */
    static void putStringOrArray(JsonObject object, String member, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        if (values.size() == 1) {
            object.addProperty(member, values.get(0));
            return;
        }
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        object.add(member, array);
    }

    static String string(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    static Integer integer(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsInt();
    }

    static boolean bool(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element != null && !element.isJsonNull() && element.getAsBoolean();
    }

    static Number number(JsonObject object, String member) {
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            String text = element.getAsString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return toNumber(new BigDecimal(text));
            } catch (NumberFormatException e) {
                throw new JsonParseException("'" + member + "' is not a number: " + text, e);
            }
        }
        return toNumber(element.getAsBigDecimal());
    }

    static JsonObject object(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
    }

    static JsonArray array(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element != null && element.isJsonArray() ? element.getAsJsonArray() : new JsonArray();
    }

    static String required(JsonObject object, String member) {
        String value = string(object, member);
        if (value == null || value.isBlank()) {
            throw new JsonParseException("Missing required member '" + member + "'");
        }
        return value;
    }
}
