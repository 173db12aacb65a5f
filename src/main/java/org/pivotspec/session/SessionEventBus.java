package org.pivotspec.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process publish/subscribe channel scoped to one editing session.
 * <p>
 * Listeners run synchronously on the publishing thread in subscription order. A failing
 * listener is logged and does not prevent delivery to the others.
 */
public class SessionEventBus {

    private static final Logger log = LoggerFactory.getLogger(SessionEventBus.class);

    private final List<Listener<?>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Subscribes to one event type.
     *
     * @param type     event class
     * @param consumer callback
     * @param <E>      event type
     * @return handle that unsubscribes when closed
     */
    public <E extends SessionEvent> Subscription subscribe(Class<E> type, Consumer<? super E> consumer) {
        Listener<E> listener = new Listener<>(type, consumer);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Subscribes to every event.
     *
     * @param consumer callback
     * @return handle that unsubscribes when closed
     */
    public Subscription subscribeAll(Consumer<? super SessionEvent> consumer) {
        return subscribe(SessionEvent.class, consumer);
    }

    /**
     * Delivers an event to matching listeners.
     *
     * @param event the event
     */
    public void publish(SessionEvent event) {
        for (Listener<?> listener : listeners) {
            try {
                listener.deliver(event);
            } catch (RuntimeException e) {
                log.warn("Session listener failed on {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Handle of a subscription.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private record Listener<E extends SessionEvent>(Class<E> type, Consumer<? super E> consumer) {
        void deliver(SessionEvent event) {
            if (type.isInstance(event)) {
                consumer.accept(type.cast(event));
            }
        }
    }
}
