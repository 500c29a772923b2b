package com.graphload.core.service.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One uploaded file's ingestion unit.
 *
 * Created once per file and mutated only by the ingestion pipeline while it
 * processes the file; terminal once COMPLETED or FAILED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UploadTask {

    private long id;

    private long datasetId;

    private String fileName;

    private String filePath;

    private FileKind kind;

    /** Node files only. */
    private String nodeLabel;

    /** Relationship files only. */
    private String relationshipType;

    /** Relationship files only: declared or resolved endpoint labels. */
    private String sourceLabel;

    private String targetLabel;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private int totalRows;

    private int processedRows;

    private double progressPercentage;

    private String errorMessage;

    @Builder.Default
    private Map<String, Object> errorDetails = new LinkedHashMap<>();

    @Builder.Default
    private List<String> validationWarnings = new ArrayList<>();

    private Instant startedAt;

    private Instant completedAt;

    private Instant createdAt;

    private Instant updatedAt;

    public String getLabelOrType() {
        return kind == FileKind.RELATIONSHIP ? relationshipType : nodeLabel;
    }

    /**
     * Copy that shares no mutable collections with this task.
     */
    public UploadTask copy() {
        return toBuilder()
                .errorDetails(errorDetails == null ? new LinkedHashMap<>() : new LinkedHashMap<>(errorDetails))
                .validationWarnings(validationWarnings == null ? new ArrayList<>() : new ArrayList<>(validationWarnings))
                .build();
    }
}
