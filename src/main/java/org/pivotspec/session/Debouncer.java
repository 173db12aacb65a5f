package org.pivotspec.session;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Trailing-edge debounce on a scheduler: only the last action of a burst runs, once the
 * quiet period has elapsed after it.
 * <p>
 * Not thread-safe; call it from the scheduler's own thread.
 */
class Debouncer {

    private final ScheduledExecutorService scheduler;
    private final Duration delay;
    private ScheduledFuture<?> pending;
    private Runnable pendingAction;

    Debouncer(ScheduledExecutorService scheduler, Duration delay) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    /**
     * Schedules the action, replacing any action not yet run.
     */
    void trigger(Runnable action) {
        cancel();
        pendingAction = action;
        pending = scheduler.schedule(this::runPending, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void cancel() {
        if (pending != null) {
            pending.cancel(false);
        }
        pending = null;
        pendingAction = null;
    }

    boolean isPending() {
        return pendingAction != null;
    }

    private void runPending() {
        Runnable action = pendingAction;
        pending = null;
        pendingAction = null;
        if (action != null) {
            action.run();
        }
    }
}
