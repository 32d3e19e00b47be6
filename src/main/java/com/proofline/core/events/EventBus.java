package com.proofline.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of scheduler events to in-process listeners such as the console progress printer.
 * <p>
 * The scheduler publishes from its control-loop thread only, so listeners see the events of a
 * session in the order they happened. Listeners are invoked in subscription order; one that
 * throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<SessionEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(SessionEvent event) {
        log.debug("{} session={} task={}", event.eventType(), event.sessionId(), event.taskId());
        for (Consumer<SessionEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for task {}: {}", event.eventType(), event.taskId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for every event published from now on.
     *
     * @return a handle that removes the listener when closed
     */
    public Subscription subscribe(Consumer<SessionEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }

    /** Closing is idempotent. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
