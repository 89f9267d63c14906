package com.coursegen.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for generation run events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Publishing happens from worker threads, so delivery is synchronous on the
 * publisher's thread and subscribers must be thread-safe.
 * <p>
 * A run's subscribers are released once the event reporting its final status has been
 * delivered. A resumed run is a new invocation and needs new subscriptions.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GenerationEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<GenerationEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(GenerationEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<GenerationEvent>> subs = runSubscribers.get(event.runId());
        if (subs != null) {
            for (Consumer<GenerationEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<GenerationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
        if (event.isRunFinished() && subs != null && runSubscribers.remove(event.runId(), subs)) {
            log.debug("Released {} subscriber(s) of finished run {}", subs.size(), event.runId());
        }
    }

    public int subscriberCount(String runId) {
        List<Consumer<GenerationEvent>> subs = runSubscribers.get(runId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Subscribe to events for one run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<GenerationEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<GenerationEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(runId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<GenerationEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GenerationEvent> subscriber, GenerationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
