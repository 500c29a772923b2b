package com.graphload.core.service.task;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A logical graph subset grouping the files of one upload run.
 *
 * Every node and relationship ingested for the dataset carries its id as the dataset tag.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Dataset {

    private long id;

    private String name;

    private String description;

    /**
     * When set, a re-uploaded node file removes nodes absent from it and a
     * re-uploaded relationship file replaces every relationship of its type.
     */
    private boolean cascadeDelete;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private int totalFiles;

    private int processedFiles;

    private long totalNodes;

    private long totalRelationships;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Share of files that reached a terminal state.
     */
    public int getProgressPercentage() {
        return totalFiles == 0 ? 0 : (processedFiles * 100) / totalFiles;
    }
}
