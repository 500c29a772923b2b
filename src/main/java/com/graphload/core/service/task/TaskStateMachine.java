package com.graphload.core.service.task;

import com.graphload.core.service.notify.EventType;
import com.graphload.core.service.notify.ProgressNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives an upload task through {@code PENDING -> PROCESSING -> COMPLETED | FAILED}.
 *
 * Every transition is persisted through the TaskStore, recomputes the
 * dataset's aggregate status and publishes an event. Notifier failures are
 * logged and never affect the transition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskStateMachine {

    private final TaskStore taskStore;
    private final ProgressNotifier notifier;

    // ==================== Transitions ====================

    public UploadTask start(long taskId) {
        var task = taskStore.updateTask(taskId, current -> {
            requireStatus(current, TaskStatus.PENDING, "start");
            current.setStatus(TaskStatus.PROCESSING);
            current.setStartedAt(Instant.now());
            current.setProgressPercentage(0);
        });
        log.info("Task {} started: {} file '{}'", taskId, task.getKind(), task.getFileName());

        refreshDatasetStatus(task.getDatasetId());
        publish(taskId, EventType.STATUS, Map.of(
                "status", statusName(TaskStatus.PROCESSING),
                "message", "Task started",
                "percentage", 0
        ));
        return task;
    }

    /**
     * Completes a processing task.
     *
     * @param counts domain counts added to the completion event
     * @param warnings row warnings to keep on the task, already capped
     */
    public UploadTask complete(long taskId, String message, Map<String, Object> counts, List<String> warnings) {
        var task = taskStore.updateTask(taskId, current -> {
            requireStatus(current, TaskStatus.PROCESSING, "complete");
            current.setStatus(TaskStatus.COMPLETED);
            current.setCompletedAt(Instant.now());
            current.setProgressPercentage(ProgressCalculator.COMPLETE);
            current.setValidationWarnings(new ArrayList<>(warnings));
        });
        log.info("Task {} completed: {}", taskId, message);

        refreshDatasetStatus(task.getDatasetId());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", statusName(TaskStatus.COMPLETED));
        payload.put("message", message);
        payload.put("percentage", ProgressCalculator.COMPLETE);
        payload.putAll(counts);
        publish(taskId, EventType.STATUS, payload);
        return task;
    }

    /**
     * Fails a task that has not reached a terminal state yet.
     *
     * @param details structured detail stored as the task's error details
     */
    public UploadTask fail(long taskId, String message, Map<String, Object> details) {
        var task = taskStore.updateTask(taskId, current -> {
            if (current.getStatus().isTerminal()) {
                throw new IllegalStateException("Cannot fail task %d in state %s"
                        .formatted(taskId, current.getStatus()));
            }
            current.setStatus(TaskStatus.FAILED);
            current.setErrorMessage(message);
            current.setErrorDetails(new LinkedHashMap<>(details));
            current.setCompletedAt(Instant.now());
        });
        log.warn("Task {} failed: {}", taskId, message);

        refreshDatasetStatus(task.getDatasetId());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", statusName(TaskStatus.FAILED));
        payload.put("message", message);
        if (details.containsKey("errors")) {
            payload.put("errors", details.get("errors"));
        }
        publish(taskId, EventType.ERROR, payload);
        return task;
    }

    /**
     * Fails a task only if it is still PENDING, checked atomically with the
     * update. A task a worker already started is left untouched.
     *
     * @return the failed task, or empty if the task was no longer pending
     */
    public Optional<UploadTask> failIfPending(long taskId, String message, Map<String, Object> details) {
        var failed = new AtomicBoolean();
        var task = taskStore.updateTask(taskId, current -> {
            if (current.getStatus() != TaskStatus.PENDING) {
                return;
            }
            current.setStatus(TaskStatus.FAILED);
            current.setErrorMessage(message);
            current.setErrorDetails(new LinkedHashMap<>(details));
            current.setCompletedAt(Instant.now());
            failed.set(true);
        });
        if (!failed.get()) {
            log.debug("Task {} is {}, not failing it as pending", taskId, task.getStatus());
            return Optional.empty();
        }
        log.warn("Task {} failed before start: {}", taskId, message);

        refreshDatasetStatus(task.getDatasetId());
        publish(taskId, EventType.ERROR, Map.of("status", statusName(TaskStatus.FAILED), "message", message));
        return Optional.of(task);
    }

    // ==================== Progress ====================

    /**
     * Reports a preparation step (validation, parsing, sync) at a fixed percentage.
     */
    public void progress(long taskId, String message, int percentage) {
        taskStore.updateTask(taskId, current -> current.setProgressPercentage(percentage));
        publish(taskId, EventType.PROGRESS, Map.of("message", message, "percentage", percentage));
    }

    public void recordTotalRows(long taskId, int totalRows) {
        taskStore.updateTask(taskId, current -> current.setTotalRows(totalRows));
    }

    public void batchProgress(long taskId, int processed, int total, int batchNumber, int totalBatches) {
        int percentage = ProgressCalculator.batchPercentage(processed, total);
        taskStore.updateTask(taskId, current -> {
            current.setProcessedRows(processed);
            current.setTotalRows(total);
            current.setProgressPercentage(percentage);
        });
        log.debug("Task {} batch {}/{} done: {}/{} rows", taskId, batchNumber, totalBatches, processed, total);

        publish(taskId, EventType.PROGRESS, Map.of(
                "message", "Processing batch %d/%d".formatted(batchNumber, totalBatches),
                "percentage", percentage,
                "processed", processed,
                "total", total
        ));
    }

    // ==================== Dataset Aggregate ====================

    /**
     * Recomputes a dataset's status from its tasks: FAILED if any failed,
     * PROCESSING while any is pending or processing, COMPLETED once all completed.
     *
     * The tasks are read inside the dataset update, so concurrent recomputes
     * for one dataset are serialised and the last one sees every transition
     * that preceded it.
     */
    public TaskStatus refreshDatasetStatus(long datasetId) {
        var dataset = taskStore.updateDataset(datasetId, current -> {
            var counts = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
            var tasks = taskStore.listByDataset(datasetId, null);
            tasks.forEach(task -> counts.merge(task.getStatus(), 1, Integer::sum));

            int completed = counts.getOrDefault(TaskStatus.COMPLETED, 0);
            int failed = counts.getOrDefault(TaskStatus.FAILED, 0);
            current.setStatus(aggregateStatus(counts, tasks.size()));
            current.setProcessedFiles(completed + failed);
        });
        log.debug("Dataset {} status: {} ({} of {} files processed)",
                datasetId, dataset.getStatus(), dataset.getProcessedFiles(), dataset.getTotalFiles());
        return dataset.getStatus();
    }

    private static TaskStatus aggregateStatus(Map<TaskStatus, Integer> counts, int taskCount) {
        int active = counts.getOrDefault(TaskStatus.PENDING, 0) + counts.getOrDefault(TaskStatus.PROCESSING, 0);
        if (counts.getOrDefault(TaskStatus.FAILED, 0) > 0) {
            return TaskStatus.FAILED;
        }
        if (active > 0) {
            return TaskStatus.PROCESSING;
        }
        if (taskCount > 0 && counts.getOrDefault(TaskStatus.COMPLETED, 0) == taskCount) {
            return TaskStatus.COMPLETED;
        }
        return TaskStatus.PENDING;
    }

    // ==================== Helpers ====================

    private void requireStatus(UploadTask task, TaskStatus expected, String transition) {
        if (task.getStatus() != expected) {
            throw new IllegalStateException("Cannot %s task %d in state %s"
                    .formatted(transition, task.getId(), task.getStatus()));
        }
    }

    private void publish(long taskId, EventType type, Map<String, Object> payload) {
        try {
            notifier.publish(taskId, type, payload);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} update for task {}", type, taskId, e);
        }
    }

    private static String statusName(TaskStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
