package com.graphload.core.service.task;

/**
 * Everything needed to register an uploaded file as a task.
 *
 * @param labelOrType node label for node files, relationship type for relationship files
 * @param sourceLabel declared source label, may be null
 * @param targetLabel declared target label, may be null
 */
public record NewUploadTask(
        long datasetId,
        String fileName,
        String filePath,
        FileKind kind,
        String labelOrType,
        String sourceLabel,
        String targetLabel
) {

    public static NewUploadTask nodeFile(long datasetId, String fileName, String filePath, String label) {
        return new NewUploadTask(datasetId, fileName, filePath, FileKind.NODE, label, null, null);
    }

    public static NewUploadTask relationshipFile(long datasetId, String fileName, String filePath,
                                                 String type, String sourceLabel, String targetLabel) {
        return new NewUploadTask(datasetId, fileName, filePath, FileKind.RELATIONSHIP, type,
                sourceLabel, targetLabel);
    }
}
