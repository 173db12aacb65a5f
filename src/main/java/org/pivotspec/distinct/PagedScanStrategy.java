package org.pivotspec.distinct;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback: scans the field page by page and collects distinct values client-side.
 * <p>
 * The scan stops when a page is short, when the offset reaches the reported total, or when
 * the page ceiling is hit. Hitting the ceiling is not an error; the values collected so far
 * are returned.
 */
public class PagedScanStrategy implements IDistinctStrategy {

    private static final Logger log = LoggerFactory.getLogger(PagedScanStrategy.class);

    /** Distinct aggregation hint sent with every page. */
    static final String DISTINCT_AGG = "distinct";

    private final IQueryBackend backend;
    private final int pageSize;
    private final int maxPages;

    /**
     * @param backend  the backend
     * @param pageSize rows per page
     * @param maxPages page ceiling
     */
    public PagedScanStrategy(IQueryBackend backend, int pageSize, int maxPages) {
        if (pageSize < 1 || maxPages < 1) {
            throw new IllegalArgumentException("pageSize and maxPages must be positive");
        }
        this.backend = Objects.requireNonNull(backend, "backend");
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    @Override
    public String name() {
        return "paged-scan";
    }

    @Override
    public Optional<List<String>> resolve(DistinctQuery query) throws BackendException {
        if (query.getFormula() != null) {
            return Optional.empty();
        }
        QuerySpecFragment fragment = new QuerySpecFragment(
            query.getSource(), List.of(query.getField()), query.getWhere(), DISTINCT_AGG);

        TreeSet<String> values = new TreeSet<>();
        int offset = 0;
        int pages = 0;
        while (true) {
            PagedQueryResponse page = backend.query(
                new PagedQueryRequest(fragment, query.getDatasourceId(), pageSize, offset, true));
            pages++;
            int column = page.columnIndex(query.getField());
            for (List<Object> row : page.rows()) {
                String value = column < row.size() ? DistinctValues.asString(row.get(column)) : null;
                if (value != null) {
                    values.add(value);
                }
            }

            int got = page.rows().size();
            offset += got;
            long total = page.totalRows() != null ? page.totalRows() : 0L;
            if (got < pageSize || (total > 0 && offset >= total)) {
                break;
            }
            if (pages >= maxPages) {
                log.debug("Distinct scan of '{}' stopped at page ceiling {} with {} values",
                    query.getField(), maxPages, values.size());
                break;
            }
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(values));
    }
}
