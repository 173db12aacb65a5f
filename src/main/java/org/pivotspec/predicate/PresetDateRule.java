package org.pivotspec.predicate;

import java.util.Objects;

import org.pivotspec.dates.DatePreset;
import org.pivotspec.dates.WeekStart;

/**
 * Date filter using a relative preset such as {@code this_month}.
 *
 * @param preset    the preset
 * @param weekStart first day of the week for week presets
 */
public record PresetDateRule(DatePreset preset, WeekStart weekStart) implements DateRule {

    public PresetDateRule {
        Objects.requireNonNull(preset, "preset");
        if (weekStart == null) {
            weekStart = WeekStart.MON;
        }
    }

    public static PresetDateRule of(DatePreset preset) {
        return new PresetDateRule(preset, WeekStart.MON);
    }
}
