package com.graphload.core.service.task;

import com.graphload.core.service.ingest.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-memory implementation of TaskStore.
 * Thread-safe; every read returns a copy and every update is applied atomically per record.
 */
@Slf4j
@Component
public class InMemoryTaskStore implements TaskStore {

    private final Map<Long, Dataset> datasets = new ConcurrentHashMap<>();
    private final Map<Long, UploadTask> tasks = new ConcurrentHashMap<>();
    private final AtomicLong datasetSequence = new AtomicLong();
    private final AtomicLong taskSequence = new AtomicLong();

    // ==================== Datasets ====================

    @Override
    public Dataset createDataset(String name, String description, boolean cascadeDelete) {
        var now = Instant.now();
        var dataset = Dataset.builder()
                .id(datasetSequence.incrementAndGet())
                .name(name)
                .description(description)
                .cascadeDelete(cascadeDelete)
                .createdAt(now)
                .updatedAt(now)
                .build();

        datasets.put(dataset.getId(), dataset);
        log.info("Dataset created: id={}, name={}, cascadeDelete={}", dataset.getId(), name, cascadeDelete);
        return dataset.toBuilder().build();
    }

    @Override
    public Optional<Dataset> findDataset(long datasetId) {
        return Optional.ofNullable(datasets.get(datasetId))
                .map(dataset -> dataset.toBuilder().build());
    }

    @Override
    public List<Dataset> listDatasets() {
        return datasets.values().stream()
                .sorted(Comparator.comparing(Dataset::getCreatedAt)
                        .thenComparingLong(Dataset::getId)
                        .reversed())
                .map(dataset -> dataset.toBuilder().build())
                .toList();
    }

    @Override
    public List<UploadTask> deleteDataset(long datasetId) {
        if (datasets.remove(datasetId) == null) {
            throw IngestionException.datasetNotFound(datasetId);
        }
        var removed = listByDataset(datasetId, null);
        removed.forEach(task -> tasks.remove(task.getId()));
        log.info("Dataset deleted: id={}, {} tasks removed", datasetId, removed.size());
        return removed;
    }

    @Override
    public Dataset getDataset(long datasetId) {
        return findDataset(datasetId)
                .orElseThrow(() -> IngestionException.datasetNotFound(datasetId));
    }

    @Override
    public Dataset updateDataset(long datasetId, Consumer<Dataset> mutation) {
        var updated = datasets.computeIfPresent(datasetId, (id, current) -> {
            var copy = current.toBuilder().build();
            mutation.accept(copy);
            copy.setUpdatedAt(Instant.now());
            return copy;
        });
        if (updated == null) {
            throw IngestionException.datasetNotFound(datasetId);
        }
        return updated.toBuilder().build();
    }

    // ==================== Tasks ====================

    @Override
    public UploadTask createTask(NewUploadTask newTask) {
        updateDataset(newTask.datasetId(), dataset -> dataset.setTotalFiles(dataset.getTotalFiles() + 1));

        var now = Instant.now();
        var builder = UploadTask.builder()
                .id(taskSequence.incrementAndGet())
                .datasetId(newTask.datasetId())
                .fileName(newTask.fileName())
                .filePath(newTask.filePath())
                .kind(newTask.kind())
                .sourceLabel(newTask.sourceLabel())
                .targetLabel(newTask.targetLabel())
                .createdAt(now)
                .updatedAt(now);

        if (newTask.kind() == FileKind.NODE) {
            builder.nodeLabel(newTask.labelOrType());
        } else {
            builder.relationshipType(newTask.labelOrType());
        }

        var task = builder.build();
        tasks.put(task.getId(), task);
        log.info("Upload task created: id={}, dataset={}, kind={}, file={}",
                task.getId(), task.getDatasetId(), task.getKind(), task.getFileName());
        return task.copy();
    }

    @Override
    public Optional<UploadTask> findTask(long taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(UploadTask::copy);
    }

    @Override
    public UploadTask getTask(long taskId) {
        return findTask(taskId).orElseThrow(() -> IngestionException.taskNotFound(taskId));
    }

    @Override
    public UploadTask updateTask(long taskId, Consumer<UploadTask> mutation) {
        var updated = tasks.computeIfPresent(taskId, (id, current) -> {
            var copy = current.copy();
            mutation.accept(copy);
            copy.setUpdatedAt(Instant.now());
            return copy;
        });
        if (updated == null) {
            throw IngestionException.taskNotFound(taskId);
        }
        return updated.copy();
    }

    @Override
    public List<UploadTask> listByDataset(long datasetId, FileKind kind, TaskStatus... statuses) {
        var wanted = statuses.length == 0
                ? EnumSet.allOf(TaskStatus.class)
                : EnumSet.copyOf(Arrays.asList(statuses));

        return tasks.values().stream()
                .filter(task -> task.getDatasetId() == datasetId)
                .filter(task -> kind == null || task.getKind() == kind)
                .filter(task -> wanted.contains(task.getStatus()))
                .sorted(Comparator.comparingLong(UploadTask::getId))
                .map(UploadTask::copy)
                .toList();
    }
}
