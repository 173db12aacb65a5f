package org.pivotspec.distinct;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Normalization of raw candidate values into picker values.
 */
public final class DistinctValues {

    private DistinctValues() {
        // Utility class
    }

    /**
     * Converts raw values into a sorted, deduplicated list of strings. Nulls are dropped.
     *
     * @param raw raw values, may be null
     * @return the picker values
     */
    public static List<String> normalize(Collection<?> raw) {
        TreeSet<String> sorted = new TreeSet<>();
        if (raw != null) {
            for (Object value : raw) {
                String s = asString(value);
                if (s != null) {
                    sorted.add(s);
                }
            }
        }
        return new ArrayList<>(sorted);
    }

    /**
     * Coerces a value to its picker string. Integral floating-point numbers print without a
     * fraction ({@code 5.0} becomes {@code "5"}).
     *
     * @param value raw value
     * @return the string, or null for null input
     */
    public static String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
