package com.graphload.core.service.ingest;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.csv.CsvHeader;
import com.graphload.core.service.csv.CsvParserFactory;
import com.graphload.core.service.persistence.CypherIdentifiers;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.NewUploadTask;
import com.graphload.core.service.task.TaskStateMachine;
import com.graphload.core.service.task.TaskStore;
import com.graphload.core.service.task.UploadTask;
import com.univocity.parsers.common.TextParsingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for uploads: stores the file, registers its task and queues it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final TaskStore taskStore;
    private final TaskStateMachine stateMachine;
    private final IngestionQueue queue;
    private final IngestionCancellation cancellation;
    private final CsvParserFactory parserFactory;
    private final IngestionConfig ingestionConfig;
    private final GraphLoadConfig config;

    /**
     * Registers an uploaded CSV file and queues it for ingestion.
     *
     * The kind comes from the header; the label or type from {@code labelOverride}
     * or else the file name without extension.
     *
     * @throws IngestionException DATASET_NOT_FOUND, FILE_UNREADABLE, or QUEUE_FULL when the queue stays full
     */
    public UploadTask upload(long datasetId, MultipartFile file, String labelOverride) {
        taskStore.getDataset(datasetId);
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }

        String fileName = fileNameOf(file);
        Path stored = store(file, fileName);
        NewUploadTask newTask;
        try {
            newTask = newTask(datasetId, fileName, stored, labelOverride);
        } catch (IllegalArgumentException e) {
            deleteQuietly(stored);
            throw e;
        }
        String labelOrType = newTask.labelOrType();
        var task = taskStore.createTask(newTask);
        stateMachine.refreshDatasetStatus(datasetId);

        IngestionWorkItem item = task.getKind() == FileKind.RELATIONSHIP
                ? new IngestionWorkItem.RelationshipFileWorkItem(task.getId())
                : new IngestionWorkItem.NodeFileWorkItem(task.getId());
        if (!queue.enqueue(item, ingestionConfig.getTimeout().getEnqueueMs())) {
            log.warn("Ingestion queue full, rejecting file {} of dataset {}", fileName, datasetId);
            stateMachine.fail(task.getId(), "Ingestion queue is full, please retry later", Map.of());
            deleteQuietly(stored);
            throw new IngestionException("Ingestion queue is full, please retry later", task.getId(),
                    IngestionException.QUEUE_FULL,
                    Map.of("utilization", queue.getUtilizationPercent() + "%"), null);
        }

        log.info("Queued {} file '{}' as task {} ({}) for dataset {}",
                task.getKind(), fileName, task.getId(), labelOrType, datasetId);
        return taskStore.getTask(task.getId());
    }

    /**
     * Cancels a task. A task still waiting in the queue is withdrawn and fails
     * at once; a task a worker already picked up stops before its next batch.
     *
     * @throws IllegalStateException if the task already finished
     */
    public UploadTask cancel(long taskId) {
        var task = taskStore.getTask(taskId);
        if (task.getStatus().isTerminal()) {
            throw new IllegalStateException("Task %d already %s".formatted(taskId, task.getStatus()));
        }
        cancellation.cancel(taskId);
        queue.remove(taskId);
        stateMachine.failIfPending(taskId, IngestionCancellation.CANCELLED_MESSAGE, Map.of())
                .ifPresent(failed -> {
                    cancellation.clear(taskId);
                    if (config.getFeatures().isCleanupUploadedFiles() && failed.getFilePath() != null) {
                        deleteQuietly(Path.of(failed.getFilePath()));
                    }
                });
        return taskStore.getTask(taskId);
    }

    private NewUploadTask newTask(long datasetId, String fileName, Path stored, String labelOverride) {
        CsvHeader header = readHeader(stored);
        String labelOrType = labelOrType(header.kind(), labelOverride, fileName);
        if (header.kind() == FileKind.RELATIONSHIP) {
            return NewUploadTask.relationshipFile(datasetId, fileName, stored.toString(), labelOrType,
                    declaredLabel(header.declaredSourceLabel()), declaredLabel(header.declaredTargetLabel()));
        }
        return NewUploadTask.nodeFile(datasetId, fileName, stored.toString(), labelOrType);
    }

    // ==================== Files ====================

    private Path store(MultipartFile file, String fileName) {
        try {
            var directory = Path.of(config.getUpload().getDirectory());
            Files.createDirectories(directory);
            var target = directory.resolve(UUID.randomUUID() + "_" + fileName);
            try (InputStream input = file.getInputStream()) {
                Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Stored upload {} at {}", fileName, target);
            return target;
        } catch (IOException e) {
            throw new IngestionException("Could not store uploaded file: " + e.getMessage(), null,
                    IngestionException.FILE_UNREADABLE, Map.of("exception", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Header cells of the stored file; an unreadable header yields an empty
     * header and the task fails during validation with the precise reason.
     */
    private CsvHeader readHeader(Path file) {
        var parser = parserFactory.newParser(false);
        try (InputStream input = Files.newInputStream(file)) {
            parser.beginParsing(CsvParserFactory.utf8Reader(input));
            String[] cells = parser.parseNext();
            return CsvHeader.of(cells == null ? List.of() : Arrays.asList(cells));
        } catch (IOException | TextParsingException e) {
            log.warn("Could not read header of {}: {}", file.getFileName(), e.getMessage());
            return CsvHeader.of(List.of());
        } finally {
            parser.stopParsing();
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Error cleaning up temp file {}: {}", file, e.getMessage());
        }
    }

    // ==================== Labels ====================

    private String labelOrType(FileKind kind, String labelOverride, String fileName) {
        String raw = labelOverride != null && !labelOverride.isBlank() ? labelOverride : stem(fileName);
        String normalized = CypherIdentifiers.normalize(raw, false);
        if (normalized != null) {
            return normalized;
        }
        return kind == FileKind.RELATIONSHIP
                ? config.getGraph().getDefaultRelationshipType()
                : config.getGraph().getDefaultNodeLabel();
    }

    private static String declaredLabel(String label) {
        if (label == null) {
            return null;
        }
        if (!CypherIdentifiers.isValid(label)) {
            throw new IllegalArgumentException("Invalid label in header: '" + label + "'");
        }
        return label;
    }

    private static String fileNameOf(MultipartFile file) {
        String original = file.getOriginalFilename();
        if (original == null || original.isBlank()) {
            return "upload.csv";
        }
        // browsers on Windows may send the full client path
        String name = original.replace('\\', '/');
        return name.substring(name.lastIndexOf('/') + 1);
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
