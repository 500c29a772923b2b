package com.graphload.core.service.dataset;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.ingest.IngestionException;
import com.graphload.core.service.notify.ProgressNotifier;
import com.graphload.core.service.persistence.GraphStore;
import com.graphload.core.service.task.Dataset;
import com.graphload.core.service.task.TaskStatus;
import com.graphload.core.service.task.TaskStore;
import com.graphload.core.service.task.UploadTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dataset lifecycle: creation, listing, graph metadata and removal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetService {

    private final TaskStore taskStore;
    private final GraphStore graphStore;
    private final ProgressNotifier notifier;
    private final GraphLoadConfig config;

    public Dataset createDataset(String name, String description, boolean cascadeDelete) {
        var dataset = taskStore.createDataset(name, description, cascadeDelete);
        log.info("Created dataset {} '{}' (cascade delete: {})", dataset.getId(), name, cascadeDelete);
        return dataset;
    }

    public List<Dataset> listDatasets() {
        return taskStore.listDatasets();
    }

    /**
     * Reads the dataset's labels and relationship types back from the graph,
     * counting only elements tagged with the dataset.
     */
    public DatasetMetadata describe(long datasetId) {
        var dataset = taskStore.getDataset(datasetId);

        var labels = new LinkedHashMap<String, DatasetMetadata.LabelMetadata>();
        long totalNodes = 0;
        for (String label : graphStore.labelsForDataset(datasetId)) {
            long count = graphStore.countNodes(label, datasetId);
            labels.put(label, new DatasetMetadata.LabelMetadata(count, graphStore.propertyKeys(label, datasetId)));
            totalNodes += count;
        }

        var types = new LinkedHashMap<String, DatasetMetadata.RelationshipTypeMetadata>();
        long totalRelationships = 0;
        for (String type : graphStore.relationshipTypesForDataset(datasetId)) {
            long count = graphStore.countRelationships(type, datasetId);
            types.put(type, new DatasetMetadata.RelationshipTypeMetadata(count));
            totalRelationships += count;
        }

        log.debug("Dataset {} metadata: {} labels, {} relationship types", datasetId, labels.size(), types.size());
        return new DatasetMetadata(datasetId, dataset.getName(), Collections.unmodifiableMap(labels),
                Collections.unmodifiableMap(types), totalNodes, totalRelationships);
    }

    /**
     * Removes the dataset, its task records and any upload files still on disk.
     * Graph elements tagged with the dataset stay in the graph.
     *
     * @throws IngestionException DATASET_NOT_FOUND, or DATASET_BUSY while a file is pending or processing
     */
    public void delete(long datasetId) {
        taskStore.getDataset(datasetId);
        var active = taskStore.listByDataset(datasetId, null, TaskStatus.PENDING, TaskStatus.PROCESSING);
        if (!active.isEmpty()) {
            throw new IngestionException("Dataset %d still has %d files in progress".formatted(datasetId, active.size()),
                    null, IngestionException.DATASET_BUSY,
                    Map.of("activeTasks", active.stream().map(UploadTask::getId).toList()), null);
        }

        var removed = taskStore.deleteDataset(datasetId);
        for (var task : removed) {
            notifier.clear(task.getId());
            deleteUpload(task);
        }
        log.info("Deleted dataset {} with {} tasks", datasetId, removed.size());
    }

    private void deleteUpload(UploadTask task) {
        if (!config.getFeatures().isCleanupUploadedFiles() || task.getFilePath() == null) {
            return;
        }
        try {
            Files.deleteIfExists(Path.of(task.getFilePath()));
        } catch (IOException e) {
            log.warn("Error cleaning up temp file {}: {}", task.getFilePath(), e.getMessage());
        }
    }
}
