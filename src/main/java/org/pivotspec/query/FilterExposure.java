package org.pivotspec.query;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-field overrides controlling whether a filter is exposed in the dashboard filter bar.
 */
public final class FilterExposure {

    private static final FilterExposure NONE = new FilterExposure(Map.of());

    private final Map<String, Boolean> overrides;

    private FilterExposure(Map<String, Boolean> overrides) {
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public static FilterExposure none() {
        return NONE;
    }

    public static FilterExposure of(Map<String, Boolean> overrides) {
        return overrides == null || overrides.isEmpty() ? NONE : new FilterExposure(overrides);
    }

    /**
     * @param field   filter field
     * @param exposed override value
     * @return a copy with the override set
     */
    public FilterExposure with(String field, boolean exposed) {
        Map<String, Boolean> next = new LinkedHashMap<>(overrides);
        next.put(field, exposed);
        return new FilterExposure(next);
    }

    /**
     * Drops the overrides of removed filters, so they do not linger as orphaned flags.
     *
     * @param fields removed filter fields
     * @return a copy without their overrides
     */
    public FilterExposure withoutFields(Collection<String> fields) {
        Map<String, Boolean> next = new LinkedHashMap<>(overrides);
        boolean changed = false;
        for (String field : fields) {
            changed |= next.remove(field) != null;
        }
        return changed ? new FilterExposure(next) : this;
    }

    /**
     * @param field filter field
     * @return true only if the field has an override set to true
     */
    public boolean isExposed(String field) {
        return Boolean.TRUE.equals(overrides.get(field));
    }

    public Map<String, Boolean> asMap() {
        return overrides;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FilterExposure other && overrides.equals(other.overrides));
    }

    @Override
    public int hashCode() {
        return overrides.hashCode();
    }

    @Override
    public String toString() {
        return "FilterExposure" + overrides;
    }
}
