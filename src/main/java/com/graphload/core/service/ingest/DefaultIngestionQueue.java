package com.graphload.core.service.ingest;

import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * IngestionQueue backed by a bounded LinkedBlockingQueue.
 *
 * Uploads beyond the capacity are rejected after the enqueue timeout,
 * which surfaces to clients as 429.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultIngestionQueue implements IngestionQueue {

    private final IngestionConfig config;
    private final MetricsConfig metricsConfig;

    private BlockingQueue<IngestionWorkItem> queue;
    private int capacity;

    @PostConstruct
    void init() {
        this.capacity = config.getQueue().getCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);

        metricsConfig.registerQueueGauge(
                "graphload.ingest.queue.size",
                "Uploaded files waiting for a worker",
                this::size
        );
        metricsConfig.registerQueueGauge(
                "graphload.ingest.queue.utilization",
                "Ingestion queue utilization percentage",
                this::getUtilizationPercent
        );

        log.info("Ingestion queue ready for {} waiting files", capacity);
    }

    @Override
    public boolean enqueue(IngestionWorkItem item, long timeoutMs) {
        try {
            boolean offered = queue.offer(item, timeoutMs, TimeUnit.MILLISECONDS);
            if (offered) {
                log.debug("Queued {} for task {} ({} waiting)",
                        item.getClass().getSimpleName(), item.taskId(), queue.size());
            } else {
                log.warn("Queue full after {} ms, rejecting task {}", timeoutMs, item.taskId());
            }
            return offered;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while queueing task {}", item.taskId(), e);
            return false;
        }
    }

    @Override
    public Optional<IngestionWorkItem> dequeue(long timeoutMs) {
        try {
            IngestionWorkItem item = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (item != null) {
                log.debug("Task {} taken after waiting since {}", item.taskId(), item.createdAt());
            }
            return Optional.ofNullable(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for work");
            return Optional.empty();
        }
    }

    @Override
    public boolean remove(long taskId) {
        boolean removed = queue.removeIf(item -> item.taskId() == taskId);
        if (removed) {
            log.info("Task {} withdrawn from the ingestion queue", taskId);
        }
        return removed;
    }

    @Override
    public OptionalInt positionOf(long taskId) {
        int position = 0;
        for (IngestionWorkItem item : queue) {
            if (item.taskId() == taskId) {
                return OptionalInt.of(position);
            }
            position++;
        }
        return OptionalInt.empty();
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }
}
