package org.pivotspec.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.pivotspec.dates.WeekStart;
import org.pivotspec.pivot.Aggregation;
import org.pivotspec.pivot.ValueSort;

/**
 * Declarative query handed to the execution backend.
 * <p>
 * The backend interprets the spec; field names are passed through verbatim and no SQL is
 * produced here.
 * <p>
 * <strong>Aggregation shape:</strong> a spec carries either {@code series} (charts and pivot
 * tables, even with a single value), or a top-level {@code y}/{@code agg} or {@code measure}
 * (KPIs), or neither (no values, data tables). The builder rejects specs mixing the two.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * QuerySpec spec = QuerySpec.builder()
 *     .source("sales.orders")
 *     .y("revenue")
 *     .agg(Aggregation.SUM)
 *     .where(Map.of("order_date__gte", "2024-03-15", "order_date__lt", "2024-03-16"))
 *     .build();
 * }</pre>
 * Empty {@code select}, {@code x}, {@code legend} and {@code series} lists mean "absent".
 */
public final class QuerySpec {

    private final String source;
    private final String sourceTableId;
    private final List<String> select;
    private final List<String> x;
    private final List<String> legend;
    private final List<SeriesSpec> series;
    private final String y;
    private final Aggregation agg;
    private final String measure;
    private final Map<String, Object> where;
    private final DateGrouping groupBy;
    private final WeekStart weekStart;
    private final ValueSort.By orderBy;
    private final ValueSort.Direction order;
    private final Integer limit;
    private final Integer offset;

    private QuerySpec(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source");
        this.sourceTableId = builder.sourceTableId;
        this.select = Collections.unmodifiableList(new ArrayList<>(builder.select));
        this.x = Collections.unmodifiableList(new ArrayList<>(builder.x));
        this.legend = Collections.unmodifiableList(new ArrayList<>(builder.legend));
        this.series = Collections.unmodifiableList(new ArrayList<>(builder.series));
        this.y = builder.y;
        this.agg = builder.agg;
        this.measure = builder.measure;
        this.where = Collections.unmodifiableMap(new LinkedHashMap<>(builder.where));
        this.groupBy = builder.groupBy;
        this.weekStart = builder.weekStart;
        this.orderBy = builder.orderBy;
        this.order = builder.order;
        this.limit = builder.limit;
        this.offset = builder.offset;

        if (!series.isEmpty() && (y != null || agg != null || measure != null)) {
            throw new IllegalStateException("series and y/agg/measure are mutually exclusive");
        }
    }

    public String getSource() {
        return source;
    }

    public String getSourceTableId() {
        return sourceTableId;
    }

    /**
     * @return explicit column list (data tables), empty if absent
     */
    public List<String> getSelect() {
        return select;
    }

    public List<String> getX() {
        return x;
    }

    public List<String> getLegend() {
        return legend;
    }

    /**
     * @return measure series, empty if absent
     */
    public List<SeriesSpec> getSeries() {
        return series;
    }

    public String getY() {
        return y;
    }

    public Aggregation getAgg() {
        return agg;
    }

    /**
     * @return measure formula of a single-aggregate widget, or null
     */
    public String getMeasure() {
        return measure;
    }

    /**
     * Returns the filter predicates as operator-suffixed sibling keys.
     *
     * @return where clause in insertion order
     */
    public Map<String, Object> getWhere() {
        return where;
    }

    public DateGrouping getGroupBy() {
        return groupBy;
    }

    public WeekStart getWeekStart() {
        return weekStart;
    }

    public ValueSort.By getOrderBy() {
        return orderBy;
    }

    public ValueSort.Direction getOrder() {
        return order;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    /**
     * @return true if the spec carries a top-level aggregator
     */
    public boolean hasSingleAggregate() {
        return y != null || agg != null || measure != null;
    }

    /**
     * Creates a builder initialized with this spec's values.
     *
     * @return New builder instance
     */
    public Builder toBuilder() {
        return new Builder()
            .source(source)
            .sourceTableId(sourceTableId)
            .select(select)
            .x(x)
            .legend(legend)
            .series(series)
            .y(y)
            .agg(agg)
            .measure(measure)
            .where(where)
            .groupBy(groupBy)
            .weekStart(weekStart)
            .orderBy(orderBy)
            .order(order)
            .limit(limit)
            .offset(offset);
    }

    /**
     * Creates a new QuerySpec builder.
     *
     * @return New builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuerySpec other)) {
            return false;
        }
        return source.equals(other.source)
            && Objects.equals(sourceTableId, other.sourceTableId)
            && select.equals(other.select)
            && x.equals(other.x)
            && legend.equals(other.legend)
            && series.equals(other.series)
            && Objects.equals(y, other.y)
            && agg == other.agg
            && Objects.equals(measure, other.measure)
            && where.equals(other.where)
            && groupBy == other.groupBy
            && weekStart == other.weekStart
            && orderBy == other.orderBy
            && order == other.order
            && Objects.equals(limit, other.limit)
            && Objects.equals(offset, other.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, sourceTableId, select, x, legend, series, y, agg, measure, where,
            groupBy, weekStart, orderBy, order, limit, offset);
    }

    @Override
    public String toString() {
        return "QuerySpec{source=" + source + ", x=" + x + ", legend=" + legend + ", series=" + series.size()
            + ", y=" + y + ", agg=" + agg + ", measure=" + measure + ", where=" + where + "}";
    }

    /**
     * Builder for QuerySpec.
     */
    public static class Builder {
        private String source;
        private String sourceTableId;
        private final List<String> select = new ArrayList<>();
        private final List<String> x = new ArrayList<>();
        private final List<String> legend = new ArrayList<>();
        private final List<SeriesSpec> series = new ArrayList<>();
        private String y;
        private Aggregation agg;
        private String measure;
        private final Map<String, Object> where = new LinkedHashMap<>();
        private DateGrouping groupBy;
        private WeekStart weekStart;
        private ValueSort.By orderBy;
        private ValueSort.Direction order;
        private Integer limit;
        private Integer offset;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sourceTableId(String sourceTableId) {
            this.sourceTableId = sourceTableId;
            return this;
        }

        /**
         * Replaces the explicit column list.
         *
         * @param columns Column names, null clears
         * @return This builder
         */
        public Builder select(List<String> columns) {
            this.select.clear();
            if (columns != null) {
                this.select.addAll(columns);
            }
            return this;
        }

        public Builder x(List<String> fields) {
            this.x.clear();
            if (fields != null) {
                this.x.addAll(fields);
            }
            return this;
        }

        public Builder x(String... fields) {
            return x(List.of(fields));
        }

        public Builder legend(List<String> fields) {
            this.legend.clear();
            if (fields != null) {
                this.legend.addAll(fields);
            }
            return this;
        }

        public Builder legend(String... fields) {
            return legend(List.of(fields));
        }

        public Builder series(List<SeriesSpec> entries) {
            this.series.clear();
            if (entries != null) {
                this.series.addAll(entries);
            }
            return this;
        }

        public Builder addSeries(SeriesSpec entry) {
            this.series.add(entry);
            return this;
        }

        public Builder y(String y) {
            this.y = y;
            return this;
        }

        public Builder agg(Aggregation agg) {
            this.agg = agg;
            return this;
        }

        public Builder measure(String measure) {
            this.measure = measure;
            return this;
        }

        /**
         * Replaces the where clause.
         *
         * @param predicates Predicate keys and values, null clears
         * @return This builder
         */
        public Builder where(Map<String, Object> predicates) {
            this.where.clear();
            if (predicates != null) {
                this.where.putAll(predicates);
            }
            return this;
        }

        public Builder groupBy(DateGrouping groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder weekStart(WeekStart weekStart) {
            this.weekStart = weekStart;
            return this;
        }

        public Builder orderBy(ValueSort.By orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder order(ValueSort.Direction order) {
            this.order = order;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        /**
         * Builds the QuerySpec.
         *
         * @return Immutable QuerySpec instance
         * @throws IllegalStateException if series and a top-level aggregate are both set
         */
        public QuerySpec build() {
            return new QuerySpec(this);
        }
    }
}
