package com.graphload.core.service.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process implementation of ProgressNotifier.
 *
 * Delivers events synchronously to subscribers registered for the task and
 * remembers the latest event per task for polling clients. Entries live as
 * long as the task record: deleting a dataset clears the events of its tasks.
 */
@Slf4j
@Component
public class InMemoryProgressNotifier implements ProgressNotifier {

    // taskId -> subscribers
    private final Map<Long, List<Consumer<ProgressEvent>>> subscribers = new ConcurrentHashMap<>();

    private final Map<Long, ProgressEvent> latestEvents = new ConcurrentHashMap<>();

    @Override
    public void publish(long taskId, EventType type, Map<String, Object> payload) {
        var event = new ProgressEvent(taskId, type, payload, Instant.now());
        latestEvents.put(taskId, event);
        log.debug("Task {} {}: {}", taskId, type, payload);

        for (var subscriber : subscribers.getOrDefault(taskId, List.of())) {
            deliver(subscriber, event);
        }
    }

    /**
     * Registers a subscriber for one task's events.
     *
     * @return handle that removes the subscription when run
     */
    public Runnable subscribe(long taskId, Consumer<ProgressEvent> subscriber) {
        subscribers.computeIfAbsent(taskId, id -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> unsubscribe(taskId, subscriber);
    }

    public Optional<ProgressEvent> latest(long taskId) {
        return Optional.ofNullable(latestEvents.get(taskId));
    }

    /**
     * Drops subscribers and the remembered event of a task.
     */
    @Override
    public void clear(long taskId) {
        subscribers.remove(taskId);
        latestEvents.remove(taskId);
    }

    private void unsubscribe(long taskId, Consumer<ProgressEvent> subscriber) {
        subscribers.computeIfPresent(taskId, (id, list) -> {
            list.remove(subscriber);
            return list.isEmpty() ? null : list;
        });
    }

    private void deliver(Consumer<ProgressEvent> subscriber, ProgressEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} event for task {}: {}", event.type(), event.taskId(), e.getMessage());
        }
    }
}
