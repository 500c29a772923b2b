package com.graphload.core.service.ingest;

/**
 * Writes a validated, parsed file to the graph.
 */
@FunctionalInterface
public interface FileIngestor {

    /**
     * @throws IngestionException to fail the task with a specific code
     */
    IngestionResult ingest(IngestionContext context);
}
