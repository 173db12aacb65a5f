package org.pivotspec.pivot;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the values zone: a field or a measure, with its aggregator and presentation.
 *
 * @param field            referenced field, or null when {@code measureId} is set
 * @param measureId        referenced measure, or null when {@code field} is set
 * @param agg              aggregator
 * @param label            display label, may be null
 * @param colorToken       palette slot 1..5, may be null
 * @param stackId          stack group, may be null
 * @param style            fill style, may be null
 * @param secondaryAxis    whether the series is drawn on the secondary axis
 * @param sort             sort preference, may be null
 * @param conditionalRules conditional coloring rules
 */
public record ValueAssignment(
    String field,
    String measureId,
    Aggregation agg,
    String label,
    Integer colorToken,
    String stackId,
    SeriesStyle style,
    boolean secondaryAxis,
    ValueSort sort,
    List<ConditionalRule> conditionalRules
) {

    public ValueAssignment {
        if ((field == null) == (measureId == null)) {
            throw new IllegalArgumentException("Exactly one of field and measureId must be set");
        }
        Objects.requireNonNull(agg, "agg");
        if (colorToken != null && (colorToken < 1 || colorToken > 5)) {
            throw new IllegalArgumentException("colorToken must be within 1..5: " + colorToken);
        }
        conditionalRules = conditionalRules == null ? List.of() : List.copyOf(conditionalRules);
    }

    public static ValueAssignment ofField(String field, Aggregation agg) {
        return new ValueAssignment(field, null, agg, null, null, null, null, false, null, List.of());
    }

    public static ValueAssignment ofMeasure(String measureId, Aggregation agg) {
        return new ValueAssignment(null, measureId, agg, null, null, null, null, false, null, List.of());
    }

    public boolean isMeasure() {
        return measureId != null;
    }

    /**
     * @return the field or measure id this value refers to
     */
    public String reference() {
        return field != null ? field : measureId;
    }

    public ValueAssignment withField(String newField) {
        return new ValueAssignment(newField, null, agg, label, colorToken, stackId, style, secondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withAgg(Aggregation newAgg) {
        return new ValueAssignment(field, measureId, newAgg, label, colorToken, stackId, style, secondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withLabel(String newLabel) {
        return new ValueAssignment(field, measureId, agg, newLabel, colorToken, stackId, style, secondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withColorToken(Integer newColorToken) {
        return new ValueAssignment(field, measureId, agg, label, newColorToken, stackId, style, secondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withStackId(String newStackId) {
        return new ValueAssignment(field, measureId, agg, label, colorToken, newStackId, style, secondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withStyle(SeriesStyle newStyle) {
        return new ValueAssignment(field, measureId, agg, label, colorToken, stackId, newStyle, secondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withSecondaryAxis(boolean newSecondaryAxis) {
        return new ValueAssignment(field, measureId, agg, label, colorToken, stackId, style, newSecondaryAxis, sort,
            conditionalRules);
    }

    public ValueAssignment withSort(ValueSort newSort) {
        return new ValueAssignment(field, measureId, agg, label, colorToken, stackId, style, secondaryAxis, newSort,
            conditionalRules);
    }

    public ValueAssignment withConditionalRules(List<ConditionalRule> newRules) {
        return new ValueAssignment(field, measureId, agg, label, colorToken, stackId, style, secondaryAxis, sort,
            newRules);
    }
}
