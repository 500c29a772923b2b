package com.graphload.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.graphload.core.service.task.UploadTask;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Upload task state as exposed over HTTP.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskResponse {

    private long id;
    private long datasetId;
    private String fileName;
    private String fileType;
    private String nodeLabel;
    private String relationshipType;
    private String sourceLabel;
    private String targetLabel;
    private String status;
    private int totalRows;
    private int processedRows;
    private double progressPercentage;
    private String errorMessage;
    private Map<String, Object> errorDetails;
    private List<String> validationWarnings;
    private Instant startedAt;
    private Instant completedAt;
    private Instant createdAt;

    public static TaskResponse from(UploadTask task) {
        return TaskResponse.builder()
                .id(task.getId())
                .datasetId(task.getDatasetId())
                .fileName(task.getFileName())
                .fileType(task.getKind() == null ? null : task.getKind().name().toLowerCase(Locale.ROOT))
                .nodeLabel(task.getNodeLabel())
                .relationshipType(task.getRelationshipType())
                .sourceLabel(task.getSourceLabel())
                .targetLabel(task.getTargetLabel())
                .status(task.getStatus().name().toLowerCase(Locale.ROOT))
                .totalRows(task.getTotalRows())
                .processedRows(task.getProcessedRows())
                .progressPercentage(task.getProgressPercentage())
                .errorMessage(task.getErrorMessage())
                .errorDetails(task.getErrorDetails() == null || task.getErrorDetails().isEmpty()
                        ? null : task.getErrorDetails())
                .validationWarnings(task.getValidationWarnings())
                .startedAt(task.getStartedAt())
                .completedAt(task.getCompletedAt())
                .createdAt(task.getCreatedAt())
                .build();
    }
}
