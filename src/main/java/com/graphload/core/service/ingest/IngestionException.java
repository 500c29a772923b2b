package com.graphload.core.service.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exception thrown when ingestion of an uploaded file cannot continue.
 *
 * Carries the task it belongs to, a stable error code, and structured detail
 * that ends up in the task's {@code errorDetails}.
 */
public class IngestionException extends RuntimeException {

    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String NO_DATA = "NO_DATA";
    public static final String LABEL_RESOLUTION_FAILED = "LABEL_RESOLUTION_FAILED";
    public static final String BATCH_FAILED = "BATCH_FAILED";
    public static final String CANCELLED = "CANCELLED";
    public static final String FILE_UNREADABLE = "FILE_UNREADABLE";
    public static final String TASK_NOT_FOUND = "TASK_NOT_FOUND";
    public static final String DATASET_NOT_FOUND = "DATASET_NOT_FOUND";
    public static final String QUEUE_FULL = "QUEUE_FULL";
    public static final String DATASET_BUSY = "DATASET_BUSY";
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";

    private final Long taskId;
    private final String errorCode;
    private final Map<String, Object> details;

    public IngestionException(String message) {
        this(message, null, "INGESTION_ERROR", Map.of(), null);
    }

    public IngestionException(String message, Throwable cause) {
        this(message, null, "INGESTION_ERROR", Map.of(), cause);
    }

    public IngestionException(String message, Long taskId, String errorCode) {
        this(message, taskId, errorCode, Map.of(), null);
    }

    public IngestionException(String message, Long taskId, String errorCode,
                              Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    // ==================== Factories ====================

    public static IngestionException validationFailed(long taskId, List<String> errors, List<String> warnings) {
        var details = new LinkedHashMap<String, Object>();
        details.put("errors", List.copyOf(errors));
        details.put("warnings", List.copyOf(warnings));
        return new IngestionException(summarize(errors), taskId, VALIDATION_FAILED, details, null);
    }

    public static IngestionException batchFailed(long taskId, int batchNumber, Throwable cause) {
        String message = "Error processing batch %d: %s".formatted(batchNumber, cause.getMessage());
        return new IngestionException(message, taskId, BATCH_FAILED,
                Map.of("exception", String.valueOf(cause.getMessage()), "batch", batchNumber), cause);
    }

    public static IngestionException taskNotFound(long taskId) {
        return new IngestionException("Task not found: " + taskId, taskId, TASK_NOT_FOUND);
    }

    public static IngestionException datasetNotFound(long datasetId) {
        return new IngestionException("Dataset not found: " + datasetId, null, DATASET_NOT_FOUND);
    }

    /**
     * One error is reported as is; several become a short list with the first three.
     */
    static String summarize(List<String> errors) {
        if (errors.size() == 1) {
            return errors.get(0);
        }
        var shown = String.join("; ", errors.subList(0, Math.min(3, errors.size())));
        return errors.size() + " issues: " + shown + (errors.size() > 3 ? "..." : "");
    }

    public Long getTaskId() {
        return taskId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
