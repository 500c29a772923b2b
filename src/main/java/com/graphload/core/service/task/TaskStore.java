package com.graphload.core.service.task;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistent record store for datasets and their upload tasks.
 *
 * Implementations hand out copies; changes go through the update methods,
 * which apply the mutation atomically and return the stored result.
 */
public interface TaskStore {

    /**
     * Creates a dataset in PENDING state with zero counts.
     */
    Dataset createDataset(String name, String description, boolean cascadeDelete);

    Optional<Dataset> findDataset(long datasetId);

    /**
     * Every dataset, newest first.
     */
    List<Dataset> listDatasets();

    /**
     * Removes a dataset together with its tasks.
     *
     * @return the removed tasks
     * @throws com.graphload.core.service.ingest.IngestionException with code DATASET_NOT_FOUND
     */
    List<UploadTask> deleteDataset(long datasetId);

    /**
     * @throws com.graphload.core.service.ingest.IngestionException with code DATASET_NOT_FOUND
     */
    Dataset getDataset(long datasetId);

    /**
     * Applies a mutation to a dataset. Updates of one dataset are serialised;
     * the mutation may read tasks but must not update datasets itself.
     */
    Dataset updateDataset(long datasetId, Consumer<Dataset> mutation);

    /**
     * Registers a PENDING task and counts it in the dataset's total files.
     */
    UploadTask createTask(NewUploadTask newTask);

    Optional<UploadTask> findTask(long taskId);

    /**
     * @throws com.graphload.core.service.ingest.IngestionException with code TASK_NOT_FOUND
     */
    UploadTask getTask(long taskId);

    UploadTask updateTask(long taskId, Consumer<UploadTask> mutation);

    /**
     * Lists a dataset's tasks in creation order.
     *
     * @param kind file kind filter, null for any
     * @param statuses status filter, none for any
     */
    List<UploadTask> listByDataset(long datasetId, FileKind kind, TaskStatus... statuses);
}
