package org.pivotspec.predicate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.pivotspec.dates.DateRange;
import org.pivotspec.dates.DateRanges;

/**
 * Compiles one field's filter UI state into a {@link WherePatch}.
 * <p>
 * Every patch first deletes all keys the field may occupy and then assigns the keys of the new
 * rule, so only one predicate shape (equality set, range or string match) is ever populated
 * per field.
 * <p>
 * <strong>Shapes written:</strong>
 * <ul>
 *   <li>String {@code eq}: {@code field = [v1, v2, ...]}; other string operators write their
 *       suffixed key with a scalar (one value) or a list (several comma-separated values)</li>
 *   <li>Number {@code eq}: {@code field = [a]}; {@code between}: {@code __gte}/{@code __lte},
 *       omitting a missing bound</li>
 *   <li>Date: {@code __gte}/{@code __lt} only, half-open</li>
 *   <li>Manual selection: {@code field = [values]}</li>
 * </ul>
 * Compilation is deterministic: the same inputs on the same day produce equal patches with
 * identical signatures.
 */
public class PredicateCompiler {

    private final Clock clock;

    /**
     * Creates a compiler resolving date presets against the system clock.
     */
    public PredicateCompiler() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Creates a compiler resolving date presets against the given clock.
     *
     * @param clock clock providing "today"
     */
    public PredicateCompiler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Compiles a field's filter rule.
     *
     * @param field base field name
     * @param kind  declared field kind
     * @param rule  the filter state
     * @return the patch to merge into the where clause
     * @throws IllegalArgumentException if the rule does not apply to the field kind
     */
    public WherePatch compile(String field, FieldKind kind, FilterRule rule) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(rule, "rule");
        if (!rule.appliesTo(kind)) {
            throw new IllegalArgumentException(
                "Rule " + rule.getClass().getSimpleName() + " cannot filter " + kind.id() + " field '" + field + "'");
        }

        WherePatch.Builder patch = clearing(field);
        if (rule instanceof ManualSelection manual) {
            writeManual(patch, field, manual);
        } else if (rule instanceof StringRule stringRule) {
            writeString(patch, field, stringRule);
        } else if (rule instanceof NumberRule numberRule) {
            writeNumber(patch, field, numberRule);
        } else if (rule instanceof DateRule dateRule) {
            writeDate(patch, field, dateRule);
        }
        return patch.build();
    }

    /**
     * Builds a patch removing every predicate key of a field.
     *
     * @param field base field name
     * @return the clearing patch
     */
    public WherePatch clear(String field) {
        return clearing(field).build();
    }

    private static WherePatch.Builder clearing(String field) {
        WherePatch.Builder patch = WherePatch.builder();
        for (String key : WhereClauses.keysOf(field)) {
            patch.delete(key);
        }
        return patch;
    }

    private static void writeManual(WherePatch.Builder patch, String field, ManualSelection manual) {
        List<Object> values = new ArrayList<>();
        for (Object value : manual.values()) {
            if (value != null && !values.contains(value)) {
                values.add(value);
            }
        }
        if (!values.isEmpty()) {
            patch.set(field, values);
        }
    }

    private static void writeString(WherePatch.Builder patch, String field, StringRule rule) {
        List<String> values = splitValues(rule.value());
        if (values.isEmpty()) {
            return;
        }
        PredicateOperator op = rule.operator().predicate();
        if (op == PredicateOperator.EQ) {
            patch.set(field, values);
        } else {
            patch.set(op.key(field), values.size() == 1 ? values.get(0) : values);
        }
    }

    private static void writeNumber(WherePatch.Builder patch, String field, NumberRule rule) {
        if (rule.operator() == NumberOperator.BETWEEN) {
            // A missing bound stays absent instead of becoming an accidental limit
            if (rule.a() != null) {
                patch.set(PredicateOperator.GTE.key(field), rule.a());
            }
            if (rule.b() != null) {
                patch.set(PredicateOperator.LTE.key(field), rule.b());
            }
            return;
        }
        if (rule.a() == null) {
            return;
        }
        PredicateOperator op = rule.operator().predicate();
        if (op == PredicateOperator.EQ) {
            patch.set(field, List.of(rule.a()));
        } else {
            patch.set(op.key(field), rule.a());
        }
    }

    private void writeDate(WherePatch.Builder patch, String field, DateRule rule) {
        DateRange range;
        if (rule instanceof PresetDateRule preset) {
            range = DateRanges.resolvePreset(preset.preset(), LocalDate.now(clock), preset.weekStart());
        } else {
            CustomDateRule custom = (CustomDateRule) rule;
            range = DateRanges.resolveCustomRange(custom.operator(), custom.a(), custom.b());
        }
        if (range.gte() != null) {
            patch.set(PredicateOperator.GTE.key(field), range.gte());
        }
        if (range.lt() != null) {
            patch.set(PredicateOperator.LT.key(field), range.lt());
        }
    }

    /**
     * Splits comma-separated user input into trimmed, non-blank values.
     */
    static List<String> splitValues(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null) {
            return values;
        }
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }
}
