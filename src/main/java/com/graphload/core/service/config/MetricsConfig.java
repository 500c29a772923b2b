package com.graphload.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for Graph Load Core Service.
 *
 * Provides custom metrics for file ingestion, batches and skipped rows.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter filesCompleted;
    private final Counter filesFailed;
    private final Counter batchesExecuted;
    private final Counter rowsSkipped;
    private final Counter labelFallbacks;

    // Timers
    private final Timer ingestionTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.filesCompleted = Counter.builder("graphload.ingest.files.completed")
                .description("Number of CSV files ingested successfully")
                .register(registry);

        this.filesFailed = Counter.builder("graphload.ingest.files.failed")
                .description("Number of CSV files whose ingestion failed")
                .register(registry);

        this.batchesExecuted = Counter.builder("graphload.ingest.batches")
                .description("Number of row batches written to the graph store")
                .register(registry);

        this.rowsSkipped = Counter.builder("graphload.ingest.rows.skipped")
                .description("Number of rows skipped because of missing identifiers or endpoints")
                .register(registry);

        this.labelFallbacks = Counter.builder("graphload.resolver.fallbacks")
                .description("Number of relationship labels assigned by the default heuristic")
                .register(registry);

        this.ingestionTimer = Timer.builder("graphload.ingest.duration")
                .description("Time taken to ingest one file")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
