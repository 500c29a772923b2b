package com.graphload.core.service.ingest;

import com.graphload.core.service.config.IngestionConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs uploaded files from the ingestion queue.
 *
 * A fixed pool of platform threads polls the queue; each thread ingests one
 * file at a time, so files run in parallel while the batches of a file stay
 * sequential. While a file runs, its task id is in the logging MDC under
 * {@code taskId}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionWorker {

    static final String MDC_TASK_ID = "taskId";

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final IngestionQueue queue;
    private final IngestionHandler<IngestionWorkItem.NodeFileWorkItem> nodeFileHandler;
    private final IngestionHandler<IngestionWorkItem.RelationshipFileWorkItem> relationshipFileHandler;
    private final IngestionConfig ingestionConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);
    private final AtomicInteger threadCounter = new AtomicInteger(0);
    private final Set<Long> runningTasks = ConcurrentHashMap.newKeySet();

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int workerCount = ingestionConfig.getWorker().getThreadCount();
        executorService = Executors.newFixedThreadPool(workerCount, this::createWorkerThread);
        running.set(true);
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::pollLoop);
        }
        log.info("Ingestion worker started with {} threads, batch size {}",
                workerCount, ingestionConfig.getWorker().getBatchSize());
    }

    /**
     * Stops polling and waits for files in flight; tasks still running after the
     * timeout are interrupted and fail as cancelled at their next batch.
     */
    @PreDestroy
    void stop() {
        running.set(false);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Interrupting ingestion of tasks {} after {}s", runningTaskIds(), SHUTDOWN_TIMEOUT_SECONDS);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        log.info("Ingestion worker stopped, {} files left in the queue", queue.size());
    }

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("ingestion-worker-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    // ==================== Polling ====================

    private void pollLoop() {
        activeWorkers.incrementAndGet();
        long pollTimeoutMs = ingestionConfig.getTimeout().getPollMs();

        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    queue.dequeue(pollTimeoutMs).ifPresent(this::run);
                } catch (Exception e) {
                    log.error("Error in ingestion worker loop", e);
                }
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void run(IngestionWorkItem item) {
        long taskId = item.taskId();
        runningTasks.add(taskId);
        MDC.put(MDC_TASK_ID, String.valueOf(taskId));
        try {
            var outcome = dispatch(item);
            log.info("Task {} finished as {}: {}", taskId, outcome.status(), outcome.message());
        } catch (IngestionException e) {
            log.error("Ingestion failed for task {}: {} [{}]", taskId, e.getMessage(), e.getErrorCode());
        } catch (Exception e) {
            log.error("Unexpected error ingesting task {}", taskId, e);
        } finally {
            MDC.remove(MDC_TASK_ID);
            runningTasks.remove(taskId);
        }
    }

    private IngestionOutcome dispatch(IngestionWorkItem item) {
        if (item instanceof IngestionWorkItem.NodeFileWorkItem nodeItem) {
            return nodeFileHandler.handle(nodeItem);
        }
        if (item instanceof IngestionWorkItem.RelationshipFileWorkItem relationshipItem) {
            return relationshipFileHandler.handle(relationshipItem);
        }
        throw new IllegalArgumentException("Unsupported work item: " + item.getClass().getSimpleName());
    }

    // ==================== Monitoring ====================

    /**
     * Number of threads currently polling or ingesting.
     */
    public int getActiveWorkerCount() {
        return activeWorkers.get();
    }

    /**
     * Ids of the tasks being ingested right now, ascending.
     */
    public Set<Long> runningTaskIds() {
        return new TreeSet<>(runningTasks);
    }
}
