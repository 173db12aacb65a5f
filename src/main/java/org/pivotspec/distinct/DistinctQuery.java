package org.pivotspec.distinct;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.pivotspec.dates.WeekStart;

/**
 * Everything a distinct strategy needs to discover a field's candidate values.
 * <p>
 * Sample rows and sample columns are whatever data the caller already holds locally (a table
 * preview, cached column samples); they feed derivation of custom and derived fields.
 */
public final class DistinctQuery {

    private final String source;
    private final String datasourceId;
    private final String field;
    private final Map<String, Object> where;
    private final String formula;
    private final List<Map<String, Object>> sampleRows;
    private final Map<String, List<Object>> sampleColumns;
    private final WeekStart weekStart;

    private DistinctQuery(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source");
        this.field = Objects.requireNonNull(builder.field, "field");
        this.datasourceId = builder.datasourceId;
        this.where = Collections.unmodifiableMap(new LinkedHashMap<>(builder.where));
        this.formula = builder.formula;
        this.sampleRows = Collections.unmodifiableList(new ArrayList<>(builder.sampleRows));
        this.sampleColumns = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sampleColumns));
        this.weekStart = builder.weekStart;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return datasource identity, or null for the default datasource
     */
    public String getDatasourceId() {
        return datasourceId;
    }

    public String getField() {
        return field;
    }

    public Map<String, Object> getWhere() {
        return where;
    }

    /**
     * @return the custom column formula, or null for plain and derived fields
     */
    public String getFormula() {
        return formula;
    }

    public List<Map<String, Object>> getSampleRows() {
        return sampleRows;
    }

    public Map<String, List<Object>> getSampleColumns() {
        return sampleColumns;
    }

    public WeekStart getWeekStart() {
        return weekStart;
    }

    /**
     * @param newWhere replacement filter context
     * @return a copy using {@code newWhere}
     */
    public DistinctQuery withWhere(Map<String, Object> newWhere) {
        return toBuilder().where(newWhere).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .source(source)
            .datasourceId(datasourceId)
            .field(field)
            .where(where)
            .formula(formula)
            .sampleRows(sampleRows)
            .sampleColumns(sampleColumns)
            .weekStart(weekStart);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for DistinctQuery.
     */
    public static class Builder {
        private String source;
        private String datasourceId;
        private String field;
        private Map<String, Object> where = Map.of();
        private String formula;
        private List<Map<String, Object>> sampleRows = List.of();
        private Map<String, List<Object>> sampleColumns = Map.of();
        private WeekStart weekStart = WeekStart.MON;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder datasourceId(String datasourceId) {
            this.datasourceId = datasourceId;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder where(Map<String, Object> where) {
            this.where = where != null ? where : Map.of();
            return this;
        }

        public Builder formula(String formula) {
            this.formula = formula;
            return this;
        }

        public Builder sampleRows(List<Map<String, Object>> sampleRows) {
            this.sampleRows = sampleRows != null ? sampleRows : List.of();
            return this;
        }

        public Builder sampleColumns(Map<String, List<Object>> sampleColumns) {
            this.sampleColumns = sampleColumns != null ? sampleColumns : Map.of();
            return this;
        }

        public Builder weekStart(WeekStart weekStart) {
            this.weekStart = weekStart != null ? weekStart : WeekStart.MON;
            return this;
        }

        public DistinctQuery build() {
            return new DistinctQuery(this);
        }
    }
}
