package com.graphload.core.service.ingest;

import com.graphload.core.service.task.TaskStatus;

/**
 * What happened to one work item.
 *
 * @param status terminal status the task reached, or its untouched status when the item was skipped
 */
public record IngestionOutcome(
        long taskId,
        TaskStatus status,
        String message,
        long rowsWritten,
        int rowsSkipped
) {

    public static IngestionOutcome failed(long taskId, String message) {
        return new IngestionOutcome(taskId, TaskStatus.FAILED, message, 0, 0);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }
}
