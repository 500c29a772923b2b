package com.graphload.core.service.notify;

import java.util.Map;

/**
 * Publish/subscribe channel for live task updates, keyed by task id.
 *
 * Publishing is fire-and-forget: implementations must not let a delivery
 * failure reach the caller.
 */
public interface ProgressNotifier {

    /**
     * Publishes an update for a task.
     *
     * @param taskId the task the update belongs to
     * @param type status, progress or error
     * @param payload event data; null values are not allowed
     */
    void publish(long taskId, EventType type, Map<String, Object> payload);

    /**
     * Forgets everything held for a task once its record is gone.
     */
    default void clear(long taskId) {
    }
}
