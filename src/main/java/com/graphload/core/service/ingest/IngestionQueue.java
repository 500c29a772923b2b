package com.graphload.core.service.ingest;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Bounded queue of uploaded files waiting for a worker.
 *
 * Items are handed out in upload order. A waiting file can be withdrawn by
 * its task id, which is how a pending task is cancelled.
 */
public interface IngestionQueue {

    /**
     * Attempts to enqueue a work item, waiting up to {@code timeoutMs} for space.
     *
     * @return true if enqueued, false if the queue stayed full
     */
    boolean enqueue(IngestionWorkItem item, long timeoutMs);

    /**
     * Takes the oldest waiting item, waiting up to {@code timeoutMs} for one.
     */
    Optional<IngestionWorkItem> dequeue(long timeoutMs);

    /**
     * Withdraws the waiting item of a task.
     *
     * @return false if the task was not waiting, e.g. because a worker already took it
     */
    boolean remove(long taskId);

    /**
     * Zero-based position of a task's item in the queue, empty if it is not waiting.
     */
    OptionalInt positionOf(long taskId);

    int size();

    int getCapacity();

    /**
     * Gets the queue utilization as a percentage (0-100).
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }
}
