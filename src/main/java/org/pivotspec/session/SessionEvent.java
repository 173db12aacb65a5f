package org.pivotspec.session;

import java.util.List;

import org.pivotspec.pivot.PivotAssignments;
import org.pivotspec.query.CompilationResult;
import org.pivotspec.query.FilterExposure;
import org.pivotspec.query.QuerySpec;

/**
 * Notifications published by an {@link EditingSession}.
 */
public sealed interface SessionEvent {

    /** The in-memory working copy changed; durable state may still be pending. */
    record WorkingCopyChanged(PivotAssignments assignments) implements SessionEvent {
    }

    /** A new valid spec became the widget's durable spec. */
    record SpecCommitted(CompilationResult result) implements SessionEvent {
    }

    /** Compilation failed; the widget keeps {@code lastValid}. */
    record CompilationFailed(String message, QuerySpec lastValid) implements SessionEvent {
    }

    /** Filters were removed and their exposure overrides dropped. */
    record FiltersRemoved(List<String> fields, FilterExposure exposure) implements SessionEvent {
    }
}
