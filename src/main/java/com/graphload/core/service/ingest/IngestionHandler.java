package com.graphload.core.service.ingest;

/**
 * Ingests the file behind one kind of work item.
 *
 * @param <T> the work item kind this handler ingests
 */
public interface IngestionHandler<T extends IngestionWorkItem> {

    /**
     * Runs the item's task to a terminal state. Failures are recorded on the task, not thrown.
     */
    IngestionOutcome handle(T workItem);
}
