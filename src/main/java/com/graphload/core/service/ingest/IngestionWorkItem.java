package com.graphload.core.service.ingest;

import java.time.Instant;

/**
 * Sealed interface for ingestion work items.
 *
 * One work item is queued per uploaded file; the item only carries the task
 * id, everything else is read from the task store when the item runs.
 */
public sealed interface IngestionWorkItem permits
        IngestionWorkItem.NodeFileWorkItem,
        IngestionWorkItem.RelationshipFileWorkItem {

    /**
     * Gets the upload task this item processes.
     */
    long taskId();

    /**
     * Gets the timestamp when this item was created.
     */
    Instant createdAt();

    /**
     * Work item for a node CSV file.
     */
    record NodeFileWorkItem(long taskId, Instant createdAt) implements IngestionWorkItem {

        public NodeFileWorkItem(long taskId) {
            this(taskId, Instant.now());
        }
    }

    /**
     * Work item for a relationship CSV file.
     */
    record RelationshipFileWorkItem(long taskId, Instant createdAt) implements IngestionWorkItem {

        public RelationshipFileWorkItem(long taskId) {
            this(taskId, Instant.now());
        }
    }
}
