package org.pivotspec.query;

import java.util.List;
import java.util.Objects;

import org.pivotspec.pivot.Aggregation;
import org.pivotspec.pivot.ConditionalRule;
import org.pivotspec.pivot.SeriesStyle;

/**
 * One measure series of a chart or pivot query.
 *
 * @param id               series identifier, {@code s0}, {@code s1}, ...
 * @param x                dimension the series is plotted against, may be null
 * @param y                aggregated field, or null for a measure series
 * @param measure          measure formula, or null for a field series
 * @param agg              aggregator
 * @param label            display label
 * @param colorToken       palette slot, may be null
 * @param stackId          stack group, may be null
 * @param style            fill style, may be null
 * @param secondaryAxis    drawn on the secondary axis
 * @param conditionalRules conditional coloring rules
 */
public record SeriesSpec(
    String id,
    String x,
    String y,
    String measure,
    Aggregation agg,
    String label,
    Integer colorToken,
    String stackId,
    SeriesStyle style,
    boolean secondaryAxis,
    List<ConditionalRule> conditionalRules
) {

    public SeriesSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(agg, "agg");
        if ((y == null) == (measure == null)) {
            throw new IllegalArgumentException("Series " + id + " needs exactly one of y and measure");
        }
        conditionalRules = conditionalRules == null ? List.of() : List.copyOf(conditionalRules);
    }
}
