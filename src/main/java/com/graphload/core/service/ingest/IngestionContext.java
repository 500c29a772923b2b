package com.graphload.core.service.ingest;

import com.graphload.core.service.csv.ParsedCsv;
import com.graphload.core.service.task.Dataset;
import com.graphload.core.service.task.UploadTask;

/**
 * Everything a FileIngestor needs for one task.
 *
 * @param task the task as it was when processing started
 * @param dataset the task's dataset as it was when processing started
 */
public record IngestionContext(
        UploadTask task,
        Dataset dataset,
        ParsedCsv csv,
        RowWarnings warnings,
        BatchRunner batches
) {

    public long taskId() {
        return task.getId();
    }

    public long datasetId() {
        return task.getDatasetId();
    }
}
