package com.graphload.core.service.api.health;

import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.ingest.IngestionQueue;
import com.graphload.core.service.ingest.IngestionWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of file ingestion: queue depth against the backpressure threshold
 * and the worker threads draining it.
 *
 * Down once the queue passes the threshold or no worker thread is alive.
 */
@Component
@RequiredArgsConstructor
public class IngestionQueueHealthIndicator implements HealthIndicator {

    private final IngestionQueue queue;
    private final IngestionWorker worker;
    private final IngestionConfig config;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();
        int workers = worker.getActiveWorkerCount();

        Health.Builder builder = utilization >= threshold || workers == 0
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("waitingFiles", queue.size())
                .withDetail("queueCapacity", queue.getCapacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("activeWorkers", workers)
                .withDetail("configuredWorkers", config.getWorker().getThreadCount())
                .withDetail("runningTasks", worker.runningTaskIds())
                .build();
    }
}
