package com.graphload.core.service.task;

/**
 * Lifecycle of an upload task and, in aggregate, of a dataset.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
