package org.pivotspec.distinct;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.pivotspec.dates.DerivedDateField;
import org.pivotspec.formula.FormulaPreview;
import org.pivotspec.formula.IFormulaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort for custom and derived fields: computes values from locally held samples.
 * <p>
 * Custom columns evaluate their formula, derived date parts apply the date-part derivation to
 * the base column. Rows come from the sample rows if any; otherwise they are synthesized by
 * zipping the per-column sample arrays to the longest array's length, bounded by the synthesis
 * limit.
 */
public class LocalDerivationStrategy implements IDistinctStrategy {

    private static final Logger log = LoggerFactory.getLogger(LocalDerivationStrategy.class);

    private final FormulaPreview preview;
    private final int synthesisLimit;

    /**
     * @param engine         formula engine for custom columns; null disables formula evaluation
     * @param synthesisLimit maximum number of synthesized rows
     */
    public LocalDerivationStrategy(IFormulaEngine engine, int synthesisLimit) {
        this.preview = engine != null ? new FormulaPreview(engine) : null;
        this.synthesisLimit = synthesisLimit;
    }

    @Override
    public String name() {
        return "local-derivation";
    }

    @Override
    public boolean cacheable() {
        return false;
    }

    @Override
    public Optional<List<String>> resolve(DistinctQuery query) {
        List<Map<String, Object>> rows = rowsOf(query);
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        List<Object> raw = new ArrayList<>();
        if (query.getFormula() != null) {
            if (preview == null) {
                return Optional.empty();
            }
            FormulaPreview.Result result = preview.evaluate(query.getFormula(), rows);
            result.diagnostic().ifPresent(error ->
                log.debug("Deriving values of '{}' hit a formula error: {}", query.getField(), error));
            raw.addAll(result.values());
        } else {
            Optional<DerivedDateField> derived = DerivedDateField.parse(query.getField());
            if (derived.isEmpty()) {
                return Optional.empty();
            }
            for (Map<String, Object> row : rows) {
                raw.add(derived.get().derive(row.get(derived.get().baseField()), query.getWeekStart()));
            }
        }

        List<String> values = DistinctValues.normalize(raw);
        return values.isEmpty() ? Optional.empty() : Optional.of(values);
    }

    List<Map<String, Object>> rowsOf(DistinctQuery query) {
        if (!query.getSampleRows().isEmpty()) {
            return query.getSampleRows();
        }
        Map<String, List<Object>> columns = query.getSampleColumns();
        int longest = 0;
        for (List<Object> column : columns.values()) {
            longest = Math.max(longest, column.size());
        }
        int count = Math.min(longest, synthesisLimit);
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
                List<Object> values = column.getValue();
                row.put(column.getKey(), i < values.size() ? values.get(i) : null);
            }
            rows.add(row);
        }
        return rows;
    }
}
