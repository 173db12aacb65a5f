package org.pivotspec.cli.commands;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.pivotspec.dates.CustomRangeOp;
import org.pivotspec.dates.DatePreset;
import org.pivotspec.dates.DateRange;
import org.pivotspec.dates.DateRanges;
import org.pivotspec.dates.DeltaMode;
import org.pivotspec.dates.DeltaPeriods;
import org.pivotspec.dates.WeekStart;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command printing the half-open range {@code {gte, lt}} of a date preset, a custom range
 * or a KPI delta comparison.
 */
@Command(
    name = "range",
    description = "Resolve a date preset (e.g. this_month), custom range (after|before|between) or delta mode"
)
public class RangeCommand implements Callable<Integer> {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    @Parameters(
        index = "0",
        description = "Preset id, custom operator, or delta mode with --delta"
    )
    private String range;

    @Option(names = {"--from"}, description = "First bound of a custom range")
    private String from;

    @Option(names = {"--to"}, description = "Second bound of a custom range")
    private String to;

    @Option(names = {"--today"}, description = "Reference date (default: current UTC date)")
    private LocalDate today;

    @Option(names = {"--week-start"}, description = "mon, sun or sat (default: mon)")
    private String weekStart;

    @Option(names = {"--delta"}, description = "Treat the argument as a delta mode, e.g. mtd_lmtd")
    private boolean delta;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        LocalDate referenceDate = today != null ? today : LocalDate.now(ZoneOffset.UTC);

        try {
            WeekStart start = WeekStart.fromId(weekStart);
            JsonObject json;
            if (delta) {
                DeltaPeriods periods = DeltaPeriods.resolve(DeltaMode.fromId(range), referenceDate, start);
                json = new JsonObject();
                json.add("current", toJson(periods.current()));
                json.add("previous", toJson(periods.previous()));
            } else {
                Optional<DatePreset> preset = DatePreset.fromId(range);
                if (preset.isPresent()) {
                    json = toJson(DateRanges.resolvePreset(preset.get(), referenceDate, start));
                } else {
                    CustomRangeOp op = CustomRangeOp.fromId(range)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown preset or range operator: " + range));
                    DateRange resolved = DateRanges.resolveCustomRange(op, from, to);
                    JsonObject custom = toJson(resolved);
                    DateRanges.matchPreset(resolved, referenceDate, start)
                        .ifPresent(match -> custom.addProperty("preset", match.id()));
                    json = custom;
                }
            }
            out.println(GSON.toJson(json));
            out.flush();
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static JsonObject toJson(DateRange range) {
        JsonObject json = new JsonObject();
        if (range.gte() != null) {
            json.addProperty("gte", range.gte());
        }
        if (range.lt() != null) {
            json.addProperty("lt", range.lt());
        }
        return json;
    }
}
