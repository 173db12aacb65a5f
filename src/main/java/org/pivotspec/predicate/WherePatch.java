package org.pivotspec.predicate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * A set of where-clause key changes produced by compiling one field's filter.
 * <p>
 * Each entry either assigns a value or, when the value is {@code null}, deletes the key.
 * Entries keep their insertion order, so compiling the same rule twice yields an identical
 * {@link #signature()}.
 */
public final class WherePatch {

    private static final Gson SIGNATURE_GSON = new GsonBuilder().serializeNulls().create();

    private final Map<String, Object> entries;

    private WherePatch(Map<String, Object> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * @return all entries; a null value marks a deletion
     */
    public Map<String, Object> entries() {
        return entries;
    }

    /**
     * @return keys this patch assigns, with their values
     */
    public Map<String, Object> assignments() {
        Map<String, Object> result = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            if (value != null) {
                result.put(key, value);
            }
        });
        return result;
    }

    /**
     * @return keys this patch deletes
     */
    public Set<String> deletions() {
        Set<String> result = new LinkedHashSet<>();
        entries.forEach((key, value) -> {
            if (value == null) {
                result.add(key);
            }
        });
        return result;
    }

    /**
     * Merges this patch into a where clause and drops deleted keys.
     *
     * @param where the current where clause, may be null
     * @return a new unmodifiable where clause
     */
    public Map<String, Object> applyTo(Map<String, Object> where) {
        Map<String, Object> result = new LinkedHashMap<>(where != null ? where : Map.of());
        entries.forEach((key, value) -> {
            if (value == null) {
                result.remove(key);
            } else {
                result.put(key, value);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * Canonical JSON form used to detect redundant re-emits.
     *
     * @return the signature
     */
    public String signature() {
        return SIGNATURE_GSON.toJson(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WherePatch other)) {
            return false;
        }
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "WherePatch" + signature();
    }

    /**
     * Builder for WherePatch. A later call for the same key replaces the earlier one.
     */
    public static final class Builder {
        private final Map<String, Object> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Assigns a value to a key.
         *
         * @param key   where-clause key
         * @param value non-null value
         * @return this builder
         */
        public Builder set(String key, Object value) {
            if (value == null) {
                throw new IllegalArgumentException("Use delete() to remove key '" + key + "'");
            }
            entries.put(key, value);
            return this;
        }

        /**
         * Marks a key for deletion.
         *
         * @param key where-clause key
         * @return this builder
         */
        public Builder delete(String key) {
            entries.put(key, null);
            return this;
        }

        public WherePatch build() {
            return new WherePatch(entries);
        }
    }
}
