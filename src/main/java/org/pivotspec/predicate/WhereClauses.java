package org.pivotspec.predicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations on flat where clauses whose keys are {@code field} or {@code field__<op>}.
 */
public final class WhereClauses {

    private WhereClauses() {
        // Utility class
    }

    /**
     * Strips a known operator suffix from a key.
     * <p>
     * Only suffixes of {@link PredicateOperator} count; {@code a__b} with an unknown {@code b}
     * is a field name in its own right.
     *
     * @param key where-clause key
     * @return the base field name
     */
    public static String baseField(String key) {
        int idx = key.lastIndexOf(PredicateOperator.SEPARATOR);
        if (idx <= 0) {
            return key;
        }
        String suffix = key.substring(idx + PredicateOperator.SEPARATOR.length());
        return PredicateOperator.fromSuffix(suffix).isPresent() ? key.substring(0, idx) : key;
    }

    /**
     * Lists every key a field's predicate may occupy.
     *
     * @param field base field name
     * @return the bare key followed by every suffixed key
     */
    public static List<String> keysOf(String field) {
        List<String> keys = new ArrayList<>();
        for (PredicateOperator op : PredicateOperator.values()) {
            keys.add(op.key(field));
        }
        return keys;
    }

    /**
     * Removes every key belonging to a field (self-exclusion for pickers).
     *
     * @param where the where clause, may be null
     * @param field field to exclude
     * @return a new unmodifiable where clause
     */
    public static Map<String, Object> withoutField(Map<String, Object> where, String field) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (where != null) {
            where.forEach((key, value) -> {
                if (!baseField(key).equals(field)) {
                    result.put(key, value);
                }
            });
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Keeps only keys whose base field is one of {@code fields}.
     *
     * @param where  the where clause, may be null
     * @param fields allowed base fields
     * @return a new unmodifiable where clause
     */
    public static Map<String, Object> retainFields(Map<String, Object> where, Collection<String> fields) {
        Set<String> allowed = new HashSet<>(fields);
        Map<String, Object> result = new LinkedHashMap<>();
        if (where != null) {
            where.forEach((key, value) -> {
                if (allowed.contains(baseField(key))) {
                    result.put(key, value);
                }
            });
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * @param where the where clause, may be null
     * @return distinct base fields in key order
     */
    public static Set<String> baseFields(Map<String, Object> where) {
        Set<String> result = new LinkedHashSet<>();
        if (where != null) {
            for (String key : where.keySet()) {
                result.add(baseField(key));
            }
        }
        return result;
    }
}
