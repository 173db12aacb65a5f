package org.pivotspec.query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.pivotspec.pivot.CustomColumn;
import org.pivotspec.pivot.MeasureDefinition;

/**
 * Configuration of the widget being edited.
 *
 * @param id            widget identifier, may be null for unsaved widgets
 * @param source        source table
 * @param sourceTableId opaque source identity, may be null
 * @param datasourceId  datasource identity, may be null
 * @param options       type-specific options; determine the widget type
 * @param measures      measures available to value assignments
 * @param customColumns widget custom columns
 * @param filtersExpose filter-bar exposure overrides
 */
public record WidgetConfig(
    String id,
    String source,
    String sourceTableId,
    String datasourceId,
    WidgetOptions options,
    List<MeasureDefinition> measures,
    List<CustomColumn> customColumns,
    FilterExposure filtersExpose
) {

    public WidgetConfig {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
        measures = measures == null ? List.of() : List.copyOf(measures);
        customColumns = customColumns == null ? List.of() : List.copyOf(customColumns);
        filtersExpose = filtersExpose == null ? FilterExposure.none() : filtersExpose;
    }

    /**
     * Creates a widget without measures, custom columns or exposure overrides.
     */
    public static WidgetConfig of(String source, WidgetOptions options) {
        return new WidgetConfig(null, source, null, null, options, List.of(), List.of(), FilterExposure.none());
    }

    public WidgetType type() {
        return options.type();
    }

    /**
     * @param measureId measure identifier
     * @return the measure, or empty if the widget does not define it
     */
    public Optional<MeasureDefinition> measure(String measureId) {
        for (MeasureDefinition measure : measures) {
            if (measure.id().equals(measureId)) {
                return Optional.of(measure);
            }
        }
        return Optional.empty();
    }

    /**
     * @param name custom column name
     * @return the custom column, or empty
     */
    public Optional<CustomColumn> customColumn(String name) {
        for (CustomColumn column : customColumns) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public WidgetConfig withFiltersExpose(FilterExposure exposure) {
        return new WidgetConfig(id, source, sourceTableId, datasourceId, options, measures, customColumns, exposure);
    }

    public WidgetConfig withMeasures(List<MeasureDefinition> newMeasures) {
        return new WidgetConfig(id, source, sourceTableId, datasourceId, options, newMeasures, customColumns,
            filtersExpose);
    }
}
