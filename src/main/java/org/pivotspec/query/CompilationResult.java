package org.pivotspec.query;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link QuerySpecCompiler}.
 *
 * @param spec           the compiled query
 * @param filters        filter fields the spec was compiled for
 * @param removedFilters filter fields present in the previous compilation but not in this one
 */
public record CompilationResult(QuerySpec spec, List<String> filters, List<String> removedFilters) {

    public CompilationResult {
        Objects.requireNonNull(spec, "spec");
        filters = filters == null ? List.of() : List.copyOf(filters);
        removedFilters = removedFilters == null ? List.of() : List.copyOf(removedFilters);
    }

    public boolean hasRemovedFilters() {
        return !removedFilters.isEmpty();
    }
}
