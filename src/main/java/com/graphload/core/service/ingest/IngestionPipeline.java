package com.graphload.core.service.ingest;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.config.MetricsConfig;
import com.graphload.core.service.csv.CsvFileParser;
import com.graphload.core.service.csv.CsvValidationException;
import com.graphload.core.service.csv.CsvValidator;
import com.graphload.core.service.csv.ParsedCsv;
import com.graphload.core.service.csv.ValidationResult;
import com.graphload.core.service.resolve.LabelResolutionException;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.ProgressCalculator;
import com.graphload.core.service.task.TaskStateMachine;
import com.graphload.core.service.task.TaskStatus;
import com.graphload.core.service.task.TaskStore;
import com.graphload.core.service.task.UploadTask;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one uploaded file through validation, parsing and ingestion.
 *
 * The task is started, driven through the progress steps and always left
 * COMPLETED or FAILED; failures never escape to the worker. The uploaded
 * file is removed once the task is terminal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionPipeline {

    static final String NO_DATA_MESSAGE = "CSV file contains no data";

    private final TaskStore taskStore;
    private final TaskStateMachine stateMachine;
    private final CsvValidator validator;
    private final CsvFileParser parser;
    private final IngestionCancellation cancellation;
    private final MetricsConfig metricsConfig;
    private final IngestionConfig ingestionConfig;
    private final GraphLoadConfig graphLoadConfig;

    public IngestionOutcome run(long taskId, FileKind expectedKind, FileIngestor ingestor) {
        var current = taskStore.getTask(taskId);
        UploadTask started;
        try {
            started = stateMachine.start(taskId);
        } catch (IllegalStateException e) {
            // cancelled or failed before a worker picked it up
            var skipped = taskStore.getTask(taskId);
            log.info("Skipping task {}: already {}", taskId, skipped.getStatus());
            cancellation.clear(taskId);
            cleanup(current);
            return new IngestionOutcome(taskId, skipped.getStatus(), "Task already " + skipped.getStatus(), 0, 0);
        }

        var sample = Timer.start(metricsConfig.getRegistry());
        try {
            return execute(started, expectedKind, ingestor);
        } finally {
            sample.stop(metricsConfig.getIngestionTimer());
            cancellation.clear(taskId);
            cleanup(current);
        }
    }

    // ==================== Stages ====================

    private IngestionOutcome execute(UploadTask task, FileKind expectedKind, FileIngestor ingestor) {
        long taskId = task.getId();
        var warnings = new RowWarnings(ingestionConfig.getWorker().getMaxRetainedWarnings());

        try {
            var file = Path.of(task.getFilePath());

            stateMachine.progress(taskId, "Validating CSV file...", ProgressCalculator.VALIDATING);
            var validation = validate(taskId, file);
            if (validation.kind() != expectedKind) {
                throw IngestionException.validationFailed(taskId,
                        List.of("Expected a %s file but the header describes a %s file"
                                .formatted(kindName(expectedKind), kindName(validation.kind()))),
                        validation.warnings());
            }
            warnings.addAll(validation.warnings());

            cancellation.throwIfCancelled(taskId);
            stateMachine.progress(taskId, "Parsing CSV file...", ProgressCalculator.PARSING);
            ParsedCsv csv = parse(taskId, file);
            stateMachine.recordTotalRows(taskId, csv.rowCount());

            var batches = new BatchRunner(taskId, ingestionConfig.getWorker().getBatchSize(),
                    stateMachine, cancellation, metricsConfig);
            var context = new IngestionContext(task, taskStore.getDataset(task.getDatasetId()), csv, warnings, batches);
            var result = ingestor.ingest(context);

            if (warnings.skippedRows() > 0) {
                log.warn("Task {}: skipped {} rows, {} warnings recorded", taskId, warnings.skippedRows(), warnings.total());
                metricsConfig.getRowsSkipped().increment(warnings.skippedRows());
            }
            stateMachine.complete(taskId, result.message(), result.counts(), warnings.retained());
            metricsConfig.getFilesCompleted().increment();
            return new IngestionOutcome(taskId, TaskStatus.COMPLETED, result.message(),
                    result.rowsWritten(), warnings.skippedRows());

        } catch (CsvValidationException e) {
            return fail(taskId, IngestionException.validationFailed(taskId, e.getErrors(), e.getWarnings()));
        } catch (LabelResolutionException e) {
            return fail(taskId, new IngestionException(e.getMessage(), taskId, IngestionException.LABEL_RESOLUTION_FAILED,
                    Map.of("errors", List.of(e.getMessage())), e));
        } catch (IngestionException e) {
            return fail(taskId, e);
        } catch (RuntimeException e) {
            log.error("Task {} failed", taskId, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return fail(taskId, new IngestionException(message, taskId, "INGESTION_ERROR",
                    Map.of("exception", message), e));
        }
    }

    private ValidationResult validate(long taskId, Path file) {
        try {
            return validator.requireValid(file);
        } catch (IOException e) {
            throw new IngestionException("Uploaded file cannot be read: " + e.getMessage(), taskId,
                    IngestionException.FILE_UNREADABLE, Map.of("exception", String.valueOf(e.getMessage())), e);
        }
    }

    private ParsedCsv parse(long taskId, Path file) {
        var csv = parser.parse(file);
        if (csv.rowCount() == 0) {
            throw new IngestionException(NO_DATA_MESSAGE, taskId, IngestionException.NO_DATA,
                    Map.of("errors", List.of(NO_DATA_MESSAGE)), null);
        }
        return csv;
    }

    private IngestionOutcome fail(long taskId, IngestionException e) {
        log.warn("Ingestion failed for task {}: {} [{}]", taskId, e.getMessage(), e.getErrorCode());
        stateMachine.fail(taskId, e.getMessage(), e.getDetails());
        metricsConfig.getFilesFailed().increment();
        return IngestionOutcome.failed(taskId, e.getMessage());
    }

    // ==================== Cleanup ====================

    private void cleanup(UploadTask task) {
        if (!graphLoadConfig.getFeatures().isCleanupUploadedFiles() || task.getFilePath() == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(Path.of(task.getFilePath()))) {
                log.info("Cleaned up temporary file: {}", task.getFilePath());
            }
        } catch (IOException e) {
            log.warn("Error cleaning up temp file {}: {}", task.getFilePath(), e.getMessage());
        }
    }

    private static String kindName(FileKind kind) {
        return kind == null ? "unknown" : kind.name().toLowerCase(Locale.ROOT);
    }
}
