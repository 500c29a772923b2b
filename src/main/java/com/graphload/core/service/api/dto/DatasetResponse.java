package com.graphload.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.graphload.core.service.task.Dataset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * Dataset with its aggregate counts and status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DatasetResponse {

    private long id;
    private String name;
    private String description;
    private boolean cascadeDelete;
    private String status;
    private int totalFiles;
    private int processedFiles;
    private int progressPercentage;
    private long totalNodes;
    private long totalRelationships;
    private Instant createdAt;
    private Instant updatedAt;

    public static DatasetResponse from(Dataset dataset) {
        return DatasetResponse.builder()
                .id(dataset.getId())
                .name(dataset.getName())
                .description(dataset.getDescription())
                .cascadeDelete(dataset.isCascadeDelete())
                .status(dataset.getStatus().name().toLowerCase(Locale.ROOT))
                .totalFiles(dataset.getTotalFiles())
                .processedFiles(dataset.getProcessedFiles())
                .progressPercentage(dataset.getProgressPercentage())
                .totalNodes(dataset.getTotalNodes())
                .totalRelationships(dataset.getTotalRelationships())
                .createdAt(dataset.getCreatedAt())
                .updatedAt(dataset.getUpdatedAt())
                .build();
    }
}
