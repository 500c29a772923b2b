package com.graphload.core.service.ingest;

import com.graphload.core.service.config.MetricsConfig;
import com.graphload.core.service.task.TaskStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs a task's rows through the graph store in fixed-size batches, one
 * after the other, reporting progress after each.
 *
 * Cancellation is checked before every batch. A batch that throws fails the
 * task; batches already written stay written.
 */
@Slf4j
public class BatchRunner {

    /**
     * Work done for one batch.
     */
    @FunctionalInterface
    public interface BatchAction<T> {
        void process(List<T> batch, int batchNumber);
    }

    private final long taskId;
    private final int batchSize;
    private final TaskStateMachine stateMachine;
    private final IngestionCancellation cancellation;
    private final MetricsConfig metricsConfig;

    public BatchRunner(long taskId, int batchSize, TaskStateMachine stateMachine,
                       IngestionCancellation cancellation, MetricsConfig metricsConfig) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.taskId = taskId;
        this.batchSize = batchSize;
        this.stateMachine = stateMachine;
        this.cancellation = cancellation;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @param total rows the progress percentage is computed against
     */
    public <T> void forEachBatch(List<T> items, int total, BatchAction<T> action) {
        int totalBatches = (items.size() + batchSize - 1) / batchSize;

        for (int index = 0; index < totalBatches; index++) {
            int batchNumber = index + 1;
            cancellation.throwIfCancelled(taskId);

            int from = index * batchSize;
            int to = Math.min(from + batchSize, items.size());
            try {
                action.process(items.subList(from, to), batchNumber);
            } catch (IngestionException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error processing batch {} of task {}", batchNumber, taskId, e);
                throw IngestionException.batchFailed(taskId, batchNumber, e);
            }
            metricsConfig.getBatchesExecuted().increment();

            int processed = items.size() == total ? to : scaled(to, items.size(), total);
            stateMachine.batchProgress(taskId, processed, total, batchNumber, totalBatches);
        }
    }

    // skipped rows are not batched, so progress is projected onto the file's row count
    private static int scaled(int done, int size, int total) {
        return size == 0 ? total : (int) ((long) done * total / size);
    }
}
