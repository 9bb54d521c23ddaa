package com.maestro.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans execution events out to SSE streams and the CLI.
 * <p>
 * Watchers of one execution subscribe by execution id; the CLI watches everything through
 * {@link #subscribeAll}. The scheduler publishes each execution's events from one thread at a
 * time, and delivery happens on that thread, so a watcher sees them in the order they happened.
 * <p>
 * An execution's terminal event is the last one it ever publishes. Once it has been delivered
 * the watchers of that execution are released, so a watcher that never unsubscribes does not
 * outlive the execution it follows.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ExecutionEvent>>> watchers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ExecutionEvent>> allExecutions = new CopyOnWriteArrayList<>();

    public void publish(ExecutionEvent event) {
        String executionId = event.executionId();
        log.debug("Event {} for execution {} step {}", event.eventType(), executionId, event.stepId());

        List<Consumer<ExecutionEvent>> forExecution = watchers.get(executionId);
        if (forExecution != null) {
            forExecution.forEach(watcher -> deliver(watcher, event));
            if (event.isTerminal() && watchers.remove(executionId, forExecution)) {
                log.debug("Execution {} ended with {}; released {} watcher(s)",
                        executionId, event.eventType(), forExecution.size());
            }
        }
        allExecutions.forEach(watcher -> deliver(watcher, event));
    }

    /**
     * Watches one execution until its terminal event has been delivered.
     *
     * @return handle that stops delivery early; calling it after the execution ended is harmless
     */
    public Subscription subscribe(String executionId, Consumer<ExecutionEvent> watcher) {
        watchers.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(watcher);
        return () -> watchers.computeIfPresent(executionId, (k, list) -> {
            list.remove(watcher);
            return list.isEmpty() ? null : list;
        });
    }

    /** Watches every execution. Never released automatically. */
    public Subscription subscribeAll(Consumer<ExecutionEvent> watcher) {
        allExecutions.add(watcher);
        return () -> allExecutions.remove(watcher);
    }

    /** Number of watchers currently attached to one execution. */
    public int watcherCount(String executionId) {
        List<Consumer<ExecutionEvent>> forExecution = watchers.get(executionId);
        return forExecution == null ? 0 : forExecution.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<ExecutionEvent> watcher, ExecutionEvent event) {
        try {
            watcher.accept(event);
        } catch (RuntimeException e) {
            log.warn("Watcher failed on {} for execution {}: {}",
                    event.eventType(), event.executionId(), e.getMessage(), e);
        }
    }
}
