package com.warden.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for gateway events.
 * <p>
 * Supports per-event-type subscriptions and global subscriptions that receive every event.
 * A failing subscriber never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GatewayEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<GatewayEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers.
     *
     * @param event the event to publish
     */
    public void publish(GatewayEvent event) {
        log.debug("Publishing event: {} for request {}", event.eventType(), event.requestId());

        List<Consumer<GatewayEvent>> typeSubs = typeSubscribers.get(event.eventType());
        if (typeSubs != null) {
            for (Consumer<GatewayEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<GatewayEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one event type.
     *
     * @param eventType the type to subscribe to, see {@link GatewayEvents}
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<GatewayEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", eventType);
        return () -> {
            CopyOnWriteArrayList<Consumer<GatewayEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event.
     */
    public Subscription subscribeAll(Consumer<GatewayEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GatewayEvent> subscriber, GatewayEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
