package org.pivotspec.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.pivotspec.pivot.Aggregation;
import org.pivotspec.pivot.MeasureDefinition;
import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.pivot.ValueAssignment;
import org.pivotspec.pivot.ValueSort;
import org.pivotspec.predicate.WhereClauses;

/**
 * Compiles pivot assignments into a {@link QuerySpec} according to the widget's type.
 * <p>
 * Compilation is a pure function of its inputs: the same assignments, widget and previous
 * state always produce an equal result.
 * <p>
 * <strong>Policies:</strong>
 * <ul>
 *   <li><strong>KPI:</strong> a single aggregate from the first value: {@code measure} for a
 *       measure, otherwise {@code y}/{@code agg}. Never {@code series}.</li>
 *   <li><strong>Chart:</strong> one {@code series} entry per value, even for a single value.</li>
 *   <li><strong>Data table:</strong> {@code legend} becomes {@code select}; no aggregation.</li>
 *   <li><strong>Pivot table:</strong> multi-level {@code x} and {@code legend}, one
 *       {@code series} entry per value with its own aggregator.</li>
 * </ul>
 * <p>
 * <strong>Where clause:</strong> the previous where clause is carried over and every key whose
 * base field is no longer an exposed filter is pruned, including suffixed variants. Newly
 * exposed filters add nothing until they hold a value.
 */
public final class QuerySpecCompiler {

    private QuerySpecCompiler() {
        // Utility class
    }

    /**
     * Compiles against a previous spec. The previous filter set is taken to be the base fields
     * of the previous where clause.
     * <p>
     * A bare spec does not know which filters were exposed without holding a value, so removing
     * such a filter is not reported in {@link CompilationResult#removedFilters()} and its
     * exposure override is left behind. Editors that keep exposure overrides should pass the
     * previous {@link CompilationResult} instead, see
     * {@link #compile(PivotAssignments, WidgetConfig, CompilationResult)}.
     *
     * @param assignments  current assignments
     * @param widget       the widget
     * @param previousSpec previous spec, or null for a first compilation
     * @return the compilation result
     * @throws QueryCompilationException if a value references an unknown measure
     */
    public static CompilationResult compile(PivotAssignments assignments, WidgetConfig widget,
                                            QuerySpec previousSpec) {
        Map<String, Object> previousWhere = previousSpec != null ? previousSpec.getWhere() : Map.of();
        return compile(assignments, widget, previousWhere, WhereClauses.baseFields(previousWhere));
    }

    /**
     * Compiles against a previous compilation, using its exact filter list.
     *
     * @param assignments current assignments
     * @param widget      the widget
     * @param previous    previous result, or null for a first compilation
     * @return the compilation result
     * @throws QueryCompilationException if a value references an unknown measure
     */
    public static CompilationResult compile(PivotAssignments assignments, WidgetConfig widget,
                                            CompilationResult previous) {
        if (previous == null) {
            return compile(assignments, widget, (QuerySpec) null);
        }
        return compile(assignments, widget, previous.spec().getWhere(), previous.filters());
    }

    private static CompilationResult compile(PivotAssignments assignments, WidgetConfig widget,
                                             Map<String, Object> previousWhere,
                                             Collection<String> previousFilters) {
        Objects.requireNonNull(assignments, "assignments");
        Objects.requireNonNull(widget, "widget");

        QuerySpec.Builder spec = QuerySpec.builder()
            .source(widget.source())
            .sourceTableId(widget.sourceTableId())
            .where(WhereClauses.retainFields(previousWhere, assignments.filters()));

        switch (widget.type()) {
            case KPI -> compileKpi(spec, assignments, widget);
            case CHART -> compileChart(spec, assignments, widget, (WidgetOptions.Chart) widget.options());
            case DATA_TABLE -> compileDataTable(spec, assignments, (WidgetOptions.DataTable) widget.options());
            case PIVOT_TABLE -> compilePivot(spec, assignments, widget);
        }

        return new CompilationResult(spec.build(), assignments.filters(),
            removedFilters(previousFilters, assignments.filters()));
    }

    private static void compileKpi(QuerySpec.Builder spec, PivotAssignments assignments, WidgetConfig widget) {
        spec.x(assignments.x()).legend(assignments.legend());
        if (assignments.values().isEmpty()) {
            return;
        }
        ValueAssignment first = assignments.values().get(0);
        if (first.isMeasure()) {
            spec.measure(resolveMeasure(widget, first).formula());
        } else {
            spec.y(first.field()).agg(first.agg());
        }
        applySort(spec, first);
    }

    private static void compileChart(QuerySpec.Builder spec, PivotAssignments assignments, WidgetConfig widget,
                                     WidgetOptions.Chart options) {
        spec.x(assignments.x()).legend(assignments.legend());
        if (!assignments.x().isEmpty() && options.groupBy() != null) {
            spec.groupBy(options.groupBy());
            if (options.weekStart() != null) {
                spec.weekStart(options.weekStart());
            }
        }
        spec.series(toSeries(assignments, widget));
        if (!assignments.values().isEmpty()) {
            applySort(spec, assignments.values().get(0));
        }
    }

    private static void compileDataTable(QuerySpec.Builder spec, PivotAssignments assignments,
                                         WidgetOptions.DataTable options) {
        spec.select(assignments.legend());
        if (options.pageSize() != null) {
            spec.limit(options.pageSize());
        }
    }

    private static void compilePivot(QuerySpec.Builder spec, PivotAssignments assignments, WidgetConfig widget) {
        spec.x(assignments.x()).legend(assignments.legend());
        spec.series(toSeries(assignments, widget));
        if (!assignments.values().isEmpty()) {
            applySort(spec, assignments.values().get(0));
        }
    }

    private static List<SeriesSpec> toSeries(PivotAssignments assignments, WidgetConfig widget) {
        List<SeriesSpec> series = new ArrayList<>();
        List<ValueAssignment> values = assignments.values();
        for (int i = 0; i < values.size(); i++) {
            ValueAssignment value = values.get(i);
            String y = null;
            String measure = null;
            String label = value.label();
            if (value.isMeasure()) {
                MeasureDefinition definition = resolveMeasure(widget, value);
                measure = definition.formula();
                if (label == null) {
                    label = definition.name();
                }
            } else {
                y = value.field();
                if (label == null) {
                    label = defaultLabel(value.field(), value.agg());
                }
            }
            series.add(new SeriesSpec("s" + i, assignments.firstX(), y, measure, value.agg(), label,
                value.colorToken(), value.stackId(), value.style(), value.secondaryAxis(),
                value.conditionalRules()));
        }
        return series;
    }

    private static MeasureDefinition resolveMeasure(WidgetConfig widget, ValueAssignment value) {
        return widget.measure(value.measureId())
            .orElseThrow(() -> new QueryCompilationException(
                "Value references unknown measure '" + value.measureId() + "'"));
    }

    private static void applySort(QuerySpec.Builder spec, ValueAssignment value) {
        ValueSort sort = value.sort();
        if (sort != null) {
            spec.orderBy(sort.by()).order(sort.direction());
        }
    }

    static String defaultLabel(String field, Aggregation agg) {
        return agg == Aggregation.NONE ? field : agg.id() + "(" + field + ")";
    }

    private static List<String> removedFilters(Collection<String> previous, List<String> current) {
        Set<String> removed = new LinkedHashSet<>(previous);
        current.forEach(removed::remove);
        return new ArrayList<>(removed);
    }
}
