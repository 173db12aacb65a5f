package org.pivotspec.distinct;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fast path: asks the backend's distinct endpoint.
 * <p>
 * Skipped for custom columns, which have no server representation. An empty answer counts as
 * absence so the chain can try a scan.
 */
public class ServerDistinctStrategy implements IDistinctStrategy {

    private final IQueryBackend backend;

    public ServerDistinctStrategy(IQueryBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public String name() {
        return "server-distinct";
    }

    @Override
    public Optional<List<String>> resolve(DistinctQuery query) throws BackendException {
        if (query.getFormula() != null || !backend.supportsDistinct()) {
            return Optional.empty();
        }
        DistinctResponse response = backend.distinct(new DistinctRequest(
            query.getSource(), query.getField(), query.getWhere(), query.getDatasourceId()));
        List<String> values = DistinctValues.normalize(response.values());
        return values.isEmpty() ? Optional.empty() : Optional.of(values);
    }
}
