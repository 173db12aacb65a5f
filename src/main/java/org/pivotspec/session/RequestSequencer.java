package org.pivotspec.session;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last-request-wins coordination of asynchronous lookups.
 * <p>
 * Each key has at most one current request. Submitting a new request for a key cancels the
 * previous one: its upstream future is cancelled and the future returned to its caller
 * completes as cancelled, so a superseded result is never observed even if the upstream
 * work finishes later.
 * <p>
 * <strong>Thread Safety:</strong> safe for concurrent use.
 *
 * @param <K> request key type
 */
public class RequestSequencer<K> {

    private static final Logger log = LoggerFactory.getLogger(RequestSequencer.class);

    private final Map<K, InFlight> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    /**
     * Starts a request, superseding any earlier request with the same key.
     *
     * @param key     request identity
     * @param request starts the upstream work
     * @param <T>     result type
     * @return a future completing with the result, or cancelled if superseded
     */
    public <T> CompletableFuture<T> submit(K key, Supplier<? extends CompletableFuture<T>> request) {
        Objects.requireNonNull(key, "key");
        CompletableFuture<T> result = new CompletableFuture<>();
        long generation = generations.incrementAndGet();

        CompletableFuture<T> upstream;
        try {
            upstream = request.get();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return result;
        }

        InFlight current = new InFlight(generation, upstream, result);
        InFlight previous = inFlight.put(key, current);
        if (previous != null) {
            log.debug("Request #{} for {} superseded by #{}", previous.generation(), key, generation);
            previous.cancel();
        }

        upstream.whenComplete((value, error) -> {
            if (!inFlight.remove(key, current)) {
                // Superseded; the caller's future has been cancelled already.
                result.cancel(false);
                return;
            }
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    /**
     * Cancels the current request of a key, if any.
     *
     * @param key request identity
     */
    public void cancel(K key) {
        InFlight previous = inFlight.remove(key);
        if (previous != null) {
            previous.cancel();
        }
    }

    /**
     * Cancels every pending request.
     */
    public void cancelAll() {
        inFlight.keySet().forEach(this::cancel);
    }

    /**
     * @param key request identity
     * @return true if a request for the key is still running
     */
    public boolean isPending(K key) {
        return inFlight.containsKey(key);
    }

    private record InFlight(long generation, CompletableFuture<?> upstream, CompletableFuture<?> result) {
        void cancel() {
            result.cancel(false);
            upstream.cancel(true);
        }
    }
}
