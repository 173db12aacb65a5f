package org.pivotspec.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.pivotspec.cli.CommandLineInterface;
import org.pivotspec.json.FilterRuleJson;
import org.pivotspec.json.QuerySpecJson;
import org.pivotspec.json.WidgetDocument;
import org.pivotspec.json.WidgetDocumentJson;
import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.pivot.PivotPatch;
import org.pivotspec.pivot.PivotReducer;
import org.pivotspec.pivot.PivotZone;
import org.pivotspec.predicate.FieldFilter;
import org.pivotspec.predicate.PredicateCompiler;
import org.pivotspec.query.CompilationResult;
import org.pivotspec.query.QueryCompilationException;
import org.pivotspec.query.QuerySpec;
import org.pivotspec.query.QuerySpecCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command compiling a stored widget document into its backend QuerySpec.
 * <p>
 * The document's filter rules, and any rules given with {@code --filter}, are compiled into
 * the where clause first; relative date presets resolve against {@code --today}.
 */
@Command(
    name = "compile",
    description = "Compile a widget document (JSON) into a QuerySpec"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Widget document to compile"
    )
    private Path file;

    @Option(
        names = {"--today"},
        description = "Reference date for relative presets (default: current UTC date)"
    )
    private LocalDate today;

    @Option(
        names = {"--filter"},
        description = "Filter rule override as field=JSON, e.g. region='{\"type\":\"manual\",\"values\":[\"EU\"]}'"
    )
    private Map<String, String> filters = new LinkedHashMap<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            parent.getConfig();
            WidgetDocument document = WidgetDocumentJson.fromJsonString(Files.readString(file));

            Map<String, FieldFilter> rules = new LinkedHashMap<>(document.filterRules());
            for (Map.Entry<String, String> override : filters.entrySet()) {
                rules.put(override.getKey(), FilterRuleJson.fromJsonString(override.getValue()));
            }

            LocalDate referenceDate = today != null ? today : LocalDate.now(ZoneOffset.UTC);
            CompilationResult result = compile(document, rules, referenceDate);
            log.debug("Compiled widget '{}' with {} filter rule(s)", document.widget().id(), rules.size());

            out.println(GSON.toJson(toJson(result)));
            out.flush();
            return 0;
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (JsonParseException | QueryCompilationException | IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static CompilationResult compile(WidgetDocument document, Map<String, FieldFilter> rules, LocalDate today) {
        PredicateCompiler predicates = new PredicateCompiler(
            Clock.fixed(today.atStartOfDay(ZoneOffset.UTC).toInstant(), ZoneOffset.UTC));

        QuerySpec persisted = document.querySpec();
        Map<String, Object> where = persisted != null ? persisted.getWhere() : Map.of();
        PivotAssignments pivot = document.pivot();
        for (Map.Entry<String, FieldFilter> rule : rules.entrySet()) {
            String field = rule.getKey();
            FieldFilter filter = rule.getValue();
            where = predicates.compile(field, filter.kind(), filter.rule()).applyTo(where);
            pivot = PivotReducer.reduce(pivot, new PivotPatch.AddField(PivotZone.FILTERS, field));
        }

        QuerySpec previous = (persisted != null ? persisted.toBuilder() : QuerySpec.builder()
            .source(document.widget().source()))
            .where(where)
            .build();
        return QuerySpecCompiler.compile(pivot, document.widget(), previous);
    }

    private static JsonObject toJson(CompilationResult result) {
        JsonObject json = new JsonObject();
        json.add("querySpec", QuerySpecJson.toJson(result.spec()));
        JsonArray removed = new JsonArray();
        result.removedFilters().forEach(removed::add);
        json.add("removedFilters", removed);
        return json;
    }
}
