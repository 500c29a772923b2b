package com.graphload.core.service.ingest;

import java.util.Map;

/**
 * Result of ingesting the rows of one file.
 *
 * @param message completion message shown on the task
 * @param counts domain counts published with the completion event
 */
public record IngestionResult(String message, Map<String, Object> counts, long rowsWritten) {

    public IngestionResult {
        counts = Map.copyOf(counts);
    }
}
