package org.pivotspec.distinct;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

import org.pivotspec.dates.WeekStart;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.gson.Gson;

/**
 * Time-bounded cache of resolved picker values.
 * <p>
 * Entries are keyed by datasource, source, field, custom column formula, week start and the
 * effective (self-excluded) where clause, and expire a fixed time after being written.
 */
public class DistinctCache {

    private static final Gson GSON = new Gson();

    private final Cache<Key, List<String>> cache;

    /**
     * @param maximumSize maximum number of cached fields
     * @param ttl         time to live of an entry
     */
    public DistinctCache(long maximumSize, Duration ttl) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(ttl)
            .build();
    }

    public Optional<List<String>> get(DistinctQuery query) {
        return Optional.ofNullable(cache.getIfPresent(keyOf(query)));
    }

    public void put(DistinctQuery query, List<String> values) {
        cache.put(keyOf(query), List.copyOf(values));
    }

    /**
     * Drops every cached entry, e.g. after the datasource was refreshed.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static Key keyOf(DistinctQuery query) {
        // Sorted so that key order in the where clause does not split entries
        String where = GSON.toJson(new TreeMap<>(query.getWhere()));
        return new Key(query.getDatasourceId(), query.getSource(), query.getField(), query.getFormula(),
            query.getWeekStart(), where);
    }

    private record Key(String datasourceId, String source, String field, String formula, WeekStart weekStart,
                       String where) {
    }
}
