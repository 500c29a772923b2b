package com.graphload.core.service.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation requests for running tasks, honoured between batches.
 */
@Slf4j
@Component
public class IngestionCancellation {

    static final String CANCELLED_MESSAGE = "Ingestion cancelled";

    private final Set<Long> cancelled = ConcurrentHashMap.newKeySet();

    public void cancel(long taskId) {
        if (cancelled.add(taskId)) {
            log.info("Cancellation requested for task {}", taskId);
        }
    }

    public boolean isCancelled(long taskId) {
        return cancelled.contains(taskId);
    }

    /**
     * @throws IngestionException with code CANCELLED if the task was cancelled or its thread interrupted
     */
    public void throwIfCancelled(long taskId) {
        if (cancelled.contains(taskId) || Thread.currentThread().isInterrupted()) {
            throw new IngestionException(CANCELLED_MESSAGE, taskId, IngestionException.CANCELLED);
        }
    }

    public void clear(long taskId) {
        cancelled.remove(taskId);
    }
}
