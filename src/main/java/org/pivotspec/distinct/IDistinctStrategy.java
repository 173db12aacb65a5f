package org.pivotspec.distinct;

import java.util.List;
import java.util.Optional;

/**
 * One stage of the distinct-value fallback chain.
 */
public interface IDistinctStrategy {

    /**
     * @return short name used in logs
     */
    String name();

    /**
     * Attempts to resolve candidate values.
     *
     * @param query the query, already excluding the field's own constraints
     * @return sorted distinct values, or empty if this strategy does not apply or found nothing
     * @throws BackendException if a backend call fails
     */
    Optional<List<String>> resolve(DistinctQuery query) throws BackendException;

    /**
     * @return false if results depend on caller-held samples and must not be cached
     */
    default boolean cacheable() {
        return true;
    }
}
