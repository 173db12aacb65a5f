package org.pivotspec.distinct;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.pivotspec.formula.IFormulaEngine;
import org.pivotspec.predicate.WhereClauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Produces the candidate values of a filter picker.
 * <p>
 * Strategies are tried strictly one after another; the chain only advances when a strategy
 * fails or finds nothing. Nothing is fetched speculatively in parallel.
 * <p>
 * Before anything else the field's own constraints are removed from the where clause, so a
 * picker never narrows its own candidate list by its current selection.
 * <p>
 * <strong>Configuration</strong> (all optional):
 * <ul>
 *   <li>{@code page-size}: rows per scan page (default 5000)</li>
 *   <li>{@code max-pages}: scan page ceiling (default 50)</li>
 *   <li>{@code sample-synthesis-limit}: rows synthesized from column samples (default 5)</li>
 *   <li>{@code cache.maximum-size}: cached fields (default 500)</li>
 *   <li>{@code cache.expire-after-write}: entry lifetime (default 10 minutes)</li>
 * </ul>
 */
public class DistinctValueResolver {

    private static final Logger log = LoggerFactory.getLogger(DistinctValueResolver.class);

    static final int DEFAULT_PAGE_SIZE = 5000;
    static final int DEFAULT_MAX_PAGES = 50;
    static final int DEFAULT_SYNTHESIS_LIMIT = 5;
    static final long DEFAULT_CACHE_SIZE = 500;
    static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(10);

    private final List<IDistinctStrategy> strategies;
    private final DistinctCache cache;

    /**
     * Creates a resolver with the standard chain: server distinct, paged scan, local derivation.
     *
     * @param backend the query backend
     * @param engine  formula engine for custom columns, may be null
     * @param options resolver configuration
     */
    public DistinctValueResolver(IQueryBackend backend, IFormulaEngine engine, Config options) {
        int pageSize = options.hasPath("page-size") ? options.getInt("page-size") : DEFAULT_PAGE_SIZE;
        int maxPages = options.hasPath("max-pages") ? options.getInt("max-pages") : DEFAULT_MAX_PAGES;
        int synthesisLimit = options.hasPath("sample-synthesis-limit")
            ? options.getInt("sample-synthesis-limit")
            : DEFAULT_SYNTHESIS_LIMIT;
        long cacheSize = options.hasPath("cache.maximum-size")
            ? options.getLong("cache.maximum-size")
            : DEFAULT_CACHE_SIZE;
        Duration cacheTtl = options.hasPath("cache.expire-after-write")
            ? options.getDuration("cache.expire-after-write")
            : DEFAULT_CACHE_TTL;

        this.strategies = List.of(
            new ServerDistinctStrategy(backend),
            new PagedScanStrategy(backend, pageSize, maxPages),
            new LocalDerivationStrategy(engine, synthesisLimit));
        this.cache = new DistinctCache(cacheSize, cacheTtl);

        log.debug("Distinct resolver initialized: pageSize={}, maxPages={}, cacheTtl={}",
            pageSize, maxPages, cacheTtl);
    }

    /**
     * Creates a resolver with an explicit chain.
     *
     * @param strategies strategies in priority order
     * @param cache      result cache, or null to disable caching
     */
    public DistinctValueResolver(List<IDistinctStrategy> strategies, DistinctCache cache) {
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
        this.cache = cache;
    }

    /**
     * Resolves candidate values. Never throws for backend problems.
     *
     * @param query the query; its where clause may still contain the field's own constraints
     * @return sorted distinct values, empty if every strategy came up empty
     */
    public List<String> resolve(DistinctQuery query) {
        Objects.requireNonNull(query, "query");
        DistinctQuery effective = query.withWhere(WhereClauses.withoutField(query.getWhere(), query.getField()));

        if (cache != null) {
            Optional<List<String>> cached = cache.get(effective);
            if (cached.isPresent()) {
                log.debug("Distinct values of '{}' served from cache", effective.getField());
                return cached.get();
            }
        }

        for (IDistinctStrategy strategy : strategies) {
            try {
                Optional<List<String>> values = strategy.resolve(effective);
                if (values.isPresent() && !values.get().isEmpty()) {
                    log.debug("Resolved {} distinct values of '{}' via {}",
                        values.get().size(), effective.getField(), strategy.name());
                    if (cache != null && strategy.cacheable()) {
                        cache.put(effective, values.get());
                    }
                    return values.get();
                }
                log.debug("Strategy {} found no values for '{}'", strategy.name(), effective.getField());
            } catch (BackendException | RuntimeException e) {
                log.debug("Strategy {} failed for '{}', trying next: {}",
                    strategy.name(), effective.getField(), e.getMessage());
            }
        }
        log.debug("No distinct values available for '{}'", effective.getField());
        return List.of();
    }

    /**
     * Resolves candidate values on an executor.
     *
     * @param query    the query
     * @param executor executor running the resolution
     * @return a future completing with the values
     */
    public CompletableFuture<List<String>> resolveAsync(DistinctQuery query, Executor executor) {
        return CompletableFuture.supplyAsync(() -> resolve(query), executor);
    }

    /**
     * Drops all cached results.
     */
    public void invalidateCache() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }
}
