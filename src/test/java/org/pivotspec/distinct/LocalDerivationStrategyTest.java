package org.pivotspec.distinct;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.pivotspec.dates.WeekStart;
import org.pivotspec.formula.FormulaContext;
import org.pivotspec.formula.ICompiledFormula;
import org.pivotspec.formula.IFormulaEngine;

@Tag("unit")
@DisplayName("LocalDerivationStrategy")
class LocalDerivationStrategyTest {

    @Test
    @DisplayName("Synthesizes rows from column samples up to the limit")
    void synthesizesRows() {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        columns.put("a", List.of(1, 2, 3, 4, 5, 6, 7));
        columns.put("b", List.of("x"));
        DistinctQuery query = DistinctQuery.builder().source("s").field("f").sampleColumns(columns).build();

        List<Map<String, Object>> rows = new LocalDerivationStrategy(null, 5).rowsOf(query);

        assertThat(rows).hasSize(5);
        assertThat(rows.get(0)).containsEntry("a", 1).containsEntry("b", "x");
        assertThat(rows.get(4)).containsEntry("a", 5).containsEntry("b", null);
    }

    @Test
    @DisplayName("Evaluates a custom column formula over the rows")
    void customColumn() throws Exception {
        IFormulaEngine engine = mock(IFormulaEngine.class);
        ICompiledFormula formula = mock(ICompiledFormula.class);
        when(engine.compile("UPPER([region])")).thenReturn(formula);
        when(formula.exec(any(FormulaContext.class))).thenAnswer(invocation -> {
            Object region = ((FormulaContext) invocation.getArgument(0)).row().get("region");
            return region != null ? region.toString().toUpperCase() : null;
        });

        DistinctQuery query = DistinctQuery.builder()
            .source("s")
            .field("Region Upper")
            .formula("UPPER([region])")
            .sampleRows(List.of(Map.of("region", "eu"), Map.of("region", "us"), Map.of("region", "eu")))
            .build();

        assertThat(new LocalDerivationStrategy(engine, 5).resolve(query)).contains(List.of("EU", "US"));
    }

    @Test
    @DisplayName("Week parts honour the week start")
    void weekParts() {
        DistinctQuery query = DistinctQuery.builder()
            .source("s")
            .field("d (Week)")
            .weekStart(WeekStart.SUN)
            .sampleColumns(Map.of("d", Arrays.asList("2024-01-06", "2024-01-07", null)))
            .build();

        assertThat(new LocalDerivationStrategy(null, 5).resolve(query)).contains(List.of("1", "2"));
    }

    @Test
    @DisplayName("Plain fields and formulas without an engine are not derivable")
    void notDerivable() {
        DistinctQuery plain = DistinctQuery.builder()
            .source("s").field("region").sampleRows(List.of(Map.of("region", "EU"))).build();

        assertThat(new LocalDerivationStrategy(null, 5).resolve(plain)).isEmpty();
        assertThat(new LocalDerivationStrategy(null, 5).resolve(plain.toBuilder().formula("[x]").build())).isEmpty();
    }
}
