package org.pivotspec.session;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.pivotspec.dates.WeekStart;
import org.pivotspec.distinct.DistinctQuery;
import org.pivotspec.distinct.DistinctValueResolver;
import org.pivotspec.pivot.CustomColumn;
import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.pivot.PivotPatch;
import org.pivotspec.pivot.PivotReducer;
import org.pivotspec.pivot.PivotZone;
import org.pivotspec.predicate.FieldFilter;
import org.pivotspec.predicate.PatchSignatureGuard;
import org.pivotspec.predicate.PredicateCompiler;
import org.pivotspec.predicate.WherePatch;
import org.pivotspec.query.CompilationResult;
import org.pivotspec.query.QueryCompilationException;
import org.pivotspec.query.QuerySpec;
import org.pivotspec.query.QuerySpecCompiler;
import org.pivotspec.query.WidgetConfig;
import org.pivotspec.query.WidgetOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Editing state of one selected widget.
 * <p>
 * The session owns an in-memory working copy of the pivot assignments. Structural edits
 * change the working copy immediately and are committed to the durable spec once the
 * debounce period has passed without a further edit. Filter value changes commit right away,
 * together with any structural edit still pending.
 * <p>
 * All state transitions run on a single event-loop thread, so edits are applied in
 * submission order and a field's where patches never interleave. Distinct-value lookups run
 * on a separate executor; a newer lookup for the same field supersedes the older one.
 * <p>
 * A compilation error never replaces the durable spec: the previous valid spec is kept and a
 * {@link SessionEvent.CompilationFailed} event is published.
 * <p>
 * <strong>Configuration</strong> (optional):
 * <ul>
 *   <li>{@code debounce}: quiet period before a structural edit is committed (default 1500ms)</li>
 * </ul>
 * <p>
 * Closing the session discards uncommitted edits.
 */
public class EditingSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EditingSession.class);

    static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(1500);

    private final ScheduledExecutorService loop;
    private final Debouncer debouncer;
    private final SessionEventBus events;
    private final PredicateCompiler predicates;
    private final PatchSignatureGuard guard = new PatchSignatureGuard();
    private final DistinctValueResolver resolver;
    private final Executor lookupExecutor;
    private final RequestSequencer<RequestKey> lookups = new RequestSequencer<>();

    // Written on the loop thread only.
    private volatile WidgetConfig widget;
    private volatile PivotAssignments workingCopy;
    private volatile CompilationResult committed;

    private EditingSession(Builder builder) {
        this.widget = Objects.requireNonNull(builder.widget, "widget");
        this.workingCopy = builder.assignments != null ? builder.assignments : PivotAssignments.empty();
        this.events = builder.events != null ? builder.events : new SessionEventBus();
        this.predicates = builder.predicates != null ? builder.predicates : new PredicateCompiler();
        this.resolver = builder.resolver;
        this.lookupExecutor = builder.lookupExecutor != null ? builder.lookupExecutor : ForkJoinPool.commonPool();

        Config options = builder.options != null ? builder.options : ConfigFactory.empty();
        Duration debounce = options.hasPath("debounce") ? options.getDuration("debounce") : DEFAULT_DEBOUNCE;

        String name = "pivotspec-session-" + (widget.id() != null ? widget.id() : "new");
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        this.loop = executor;
        this.debouncer = new Debouncer(loop, debounce);

        if (builder.persistedSpec != null) {
            this.committed = new CompilationResult(builder.persistedSpec, workingCopy.filters(), List.of());
        } else {
            try {
                this.committed = QuerySpecCompiler.compile(workingCopy, widget, (QuerySpec) null);
            } catch (QueryCompilationException e) {
                log.warn("Initial compilation of widget '{}' failed: {}", widget.id(), e.getMessage());
            }
        }
        log.debug("Editing session '{}' opened with debounce {}", name, debounce);
    }

    /**
     * Applies a structural edit to the working copy and schedules a debounced commit.
     *
     * @param patch the edit
     * @return a future completing with the working copy after the edit
     */
    public CompletableFuture<PivotAssignments> edit(PivotPatch patch) {
        Objects.requireNonNull(patch, "patch");
        return CompletableFuture.supplyAsync(() -> {
            PivotAssignments next = PivotReducer.reduce(workingCopy, patch);
            if (next == workingCopy) {
                return next;
            }
            workingCopy = next;
            events.publish(new SessionEvent.WorkingCopyChanged(next));
            debouncer.trigger(() -> commit(currentWhere()));
            return next;
        }, loop);
    }

    /**
     * Compiles a field's filter rule into the where clause and commits immediately. A rule
     * producing the same patch as the last committed one is ignored. The field is added to the
     * filters zone if it is not there yet.
     *
     * @param field  base field name
     * @param filter kind and rule of the filter
     * @return a future completing with true if the where clause was updated; it fails with
     *         {@link IllegalArgumentException} if the rule does not fit the kind
     */
    public CompletableFuture<Boolean> applyFilter(String field, FieldFilter filter) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(filter, "filter");
        return CompletableFuture.supplyAsync(() -> {
            WherePatch patch = predicates.compile(field, filter.kind(), filter.rule());
            if (guard.isUnchanged(field, patch)) {
                return false;
            }
            if (!workingCopy.filters().contains(field)) {
                workingCopy = PivotReducer.reduce(workingCopy, new PivotPatch.AddField(PivotZone.FILTERS, field));
                events.publish(new SessionEvent.WorkingCopyChanged(workingCopy));
            }
            debouncer.cancel();
            if (commit(patch.applyTo(currentWhere())).isEmpty()) {
                // Not applied; the same rule must be accepted again once compilation succeeds.
                return false;
            }
            guard.record(field, patch);
            return true;
        }, loop);
    }

    /**
     * Removes every predicate of a field while keeping it in the filters zone.
     *
     * @param field base field name
     * @return a future completing once the change is committed
     */
    public CompletableFuture<Optional<CompilationResult>> clearFilter(String field) {
        Objects.requireNonNull(field, "field");
        return CompletableFuture.supplyAsync(() -> {
            guard.reset(field);
            debouncer.cancel();
            return commit(predicates.clear(field).applyTo(currentWhere()));
        }, loop);
    }

    /**
     * Commits pending structural edits without waiting for the debounce period.
     *
     * @return a future with the new result, empty if nothing was pending or compilation failed
     */
    public CompletableFuture<Optional<CompilationResult>> flush() {
        return CompletableFuture.supplyAsync(() -> {
            if (!debouncer.isPending()) {
                return Optional.empty();
            }
            debouncer.cancel();
            return commit(currentWhere());
        }, loop);
    }

    /**
     * Looks up the candidate values of a filter picker against the committed where clause.
     * A newer lookup for the same field cancels this one.
     *
     * @param field      field to list
     * @param sampleRows loaded rows usable for local derivation, may be empty
     * @return a future completing with the values, or cancelled if superseded
     * @throws IllegalStateException if the session has no resolver
     */
    public CompletableFuture<List<String>> distinctValues(String field, List<Map<String, Object>> sampleRows) {
        if (resolver == null) {
            throw new IllegalStateException("Editing session has no distinct value resolver");
        }
        WidgetConfig current = widget;
        RequestKey key = new RequestKey(field, current.id(), current.datasourceId());
        return lookups.submit(key, () -> CompletableFuture
            .supplyAsync(() -> distinctQuery(field, sampleRows), loop)
            .thenCompose(query -> resolver.resolveAsync(query, lookupExecutor)));
    }

    public SessionEventBus events() {
        return events;
    }

    /**
     * @return the working copy, including edits not yet committed
     */
    public PivotAssignments workingCopy() {
        return workingCopy;
    }

    public WidgetConfig widget() {
        return widget;
    }

    /**
     * @return the last valid compilation, empty if none succeeded yet
     */
    public Optional<CompilationResult> committed() {
        return Optional.ofNullable(committed);
    }

    /**
     * Discards uncommitted edits and stops the event loop.
     */
    @Override
    public void close() {
        lookups.cancelAll();
        loop.shutdownNow();
        try {
            if (!loop.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("Editing session of widget '{}' did not stop in time", widget.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Editing session of widget '{}' closed", widget.id());
    }

    /**
     * Creates a new builder.
     *
     * @return New builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    private Optional<CompilationResult> commit(Map<String, Object> where) {
        CompilationResult previous = committed;
        CompilationResult baseline = new CompilationResult(
            baselineSpec(previous).where(where).build(),
            previous != null ? previous.filters() : List.of(),
            List.of());

        CompilationResult result;
        try {
            result = QuerySpecCompiler.compile(workingCopy, widget, baseline);
        } catch (QueryCompilationException | IllegalStateException e) {
            log.warn("Compilation of widget '{}' failed, keeping last valid spec: {}", widget.id(), e.getMessage());
            events.publish(new SessionEvent.CompilationFailed(e.getMessage(),
                previous != null ? previous.spec() : null));
            return Optional.empty();
        }

        if (result.hasRemovedFilters()) {
            widget = widget.withFiltersExpose(widget.filtersExpose().withoutFields(result.removedFilters()));
            result.removedFilters().forEach(guard::reset);
            events.publish(new SessionEvent.FiltersRemoved(result.removedFilters(), widget.filtersExpose()));
        }
        committed = result;
        if (previous != null && previous.spec().equals(result.spec()) && !result.hasRemovedFilters()) {
            log.debug("Spec of widget '{}' unchanged, nothing to publish", widget.id());
        } else {
            log.info("Committed spec of widget '{}' with {} filter(s)", widget.id(), result.filters().size());
            events.publish(new SessionEvent.SpecCommitted(result));
        }
        return Optional.of(result);
    }

    private QuerySpec.Builder baselineSpec(CompilationResult previous) {
        return previous != null
            ? previous.spec().toBuilder()
            : QuerySpec.builder().source(widget.source());
    }

    private Map<String, Object> currentWhere() {
        CompilationResult current = committed;
        return current != null ? current.spec().getWhere() : Map.of();
    }

    private DistinctQuery distinctQuery(String field, List<Map<String, Object>> sampleRows) {
        WidgetConfig current = widget;
        WeekStart weekStart = current.options() instanceof WidgetOptions.Chart chart ? chart.weekStart() : null;
        return DistinctQuery.builder()
            .source(current.source())
            .datasourceId(current.datasourceId())
            .field(field)
            .where(currentWhere())
            .formula(current.customColumn(field).map(CustomColumn::formula).orElse(null))
            .sampleRows(sampleRows)
            .weekStart(weekStart)
            .build();
    }

    /**
     * Builder for EditingSession.
     */
    public static class Builder {
        private WidgetConfig widget;
        private PivotAssignments assignments;
        private QuerySpec persistedSpec;
        private Config options;
        private SessionEventBus events;
        private PredicateCompiler predicates;
        private DistinctValueResolver resolver;
        private Executor lookupExecutor;

        public Builder widget(WidgetConfig widget) {
            this.widget = widget;
            return this;
        }

        /**
         * @param assignments persisted assignments the working copy starts from
         */
        public Builder assignments(PivotAssignments assignments) {
            this.assignments = assignments;
            return this;
        }

        /**
         * @param persistedSpec durable spec of the widget; compiled from the assignments if absent
         */
        public Builder persistedSpec(QuerySpec persistedSpec) {
            this.persistedSpec = persistedSpec;
            return this;
        }

        public Builder options(Config options) {
            this.options = options;
            return this;
        }

        public Builder events(SessionEventBus events) {
            this.events = events;
            return this;
        }

        public Builder predicates(PredicateCompiler predicates) {
            this.predicates = predicates;
            return this;
        }

        public Builder resolver(DistinctValueResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * @param lookupExecutor executor running distinct lookups (default: common pool)
         */
        public Builder lookupExecutor(Executor lookupExecutor) {
            this.lookupExecutor = lookupExecutor;
            return this;
        }

        public EditingSession build() {
            return new EditingSession(this);
        }
    }
}
