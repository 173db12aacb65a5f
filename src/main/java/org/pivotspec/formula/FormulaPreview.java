package org.pivotspec.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a formula over sample rows for previews and value discovery.
 * <p>
 * Errors are captured per row: a failing row yields {@code null} and evaluation continues with
 * the next row. The first error message is kept as a diagnostic.
 */
public class FormulaPreview {

    private static final Logger log = LoggerFactory.getLogger(FormulaPreview.class);

    private final IFormulaEngine engine;

    public FormulaPreview(IFormulaEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Evaluates a formula row by row.
     *
     * @param formula formula text
     * @param rows    sample rows keyed by column name
     * @return per-row values and the first error, if any
     */
    public Result evaluate(String formula, List<Map<String, Object>> rows) {
        ICompiledFormula compiled;
        try {
            compiled = engine.compile(formula);
        } catch (FormulaEvaluationException e) {
            log.debug("Formula '{}' failed to compile: {}", formula, e.getMessage());
            return new Result(Collections.nCopies(rows.size(), null), e.getMessage());
        }

        List<Object> values = new ArrayList<>(rows.size());
        String firstError = null;
        for (int i = 0; i < rows.size(); i++) {
            try {
                values.add(compiled.exec(FormulaContext.ofRow(rows.get(i))));
            } catch (FormulaEvaluationException | RuntimeException e) {
                values.add(null);
                if (firstError == null) {
                    firstError = "Row " + (i + 1) + ": " + e.getMessage();
                    log.debug("Formula '{}' failed on row {}: {}", formula, i + 1, e.getMessage());
                }
            }
        }
        return new Result(values, firstError);
    }

    /**
     * Outcome of a preview evaluation.
     *
     * @param values     one value per input row; null where evaluation failed
     * @param firstError diagnostic of the first failure, or null
     */
    public record Result(List<Object> values, String firstError) {

        public Result {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public Optional<String> diagnostic() {
            return Optional.ofNullable(firstError);
        }
    }
}
