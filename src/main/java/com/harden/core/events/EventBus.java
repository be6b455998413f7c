package com.harden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for pipeline change events.
 * <p>
 * Every subscriber receives every event. Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all subscribers.
     */
    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for unit {}", event.eventType(), event.unitName());
        for (Consumer<PipelineEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to every event.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        subscribers.add(consumer);
        log.debug("Subscribed to all events");
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
