package com.graphload.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * Controls queue sizes, worker pools, batch sizes, validation limits,
 * sampling sizes and timeouts.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphload.ingest")
public class IngestionConfig {

    /**
     * Queue configuration.
     */
    private QueueConfig queue = new QueueConfig();

    /**
     * Worker configuration.
     */
    private WorkerConfig worker = new WorkerConfig();

    /**
     * CSV validation limits.
     */
    private ValidationConfig validation = new ValidationConfig();

    /**
     * Sampling used by type inference and label lookup.
     */
    private SamplingConfig sampling = new SamplingConfig();

    /**
     * Timeout settings.
     */
    private TimeoutConfig timeout = new TimeoutConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum queue capacity.
         */
        private int capacity = 1000;

        /**
         * Queue utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        /**
         * Number of worker threads; each runs one file at a time.
         */
        private int threadCount = 4;

        /**
         * Rows per graph-store batch.
         */
        private int batchSize = 100;

        /**
         * Row warnings retained on a task.
         */
        private int maxRetainedWarnings = 100;
    }

    @Getter
    @Setter
    public static class ValidationConfig {

        /**
         * Rows content-validated before the scan stops checking.
         */
        private int maxValidatedRows = 10000;
    }

    @Getter
    @Setter
    public static class SamplingConfig {

        /**
         * Non-null values per column used for type inference.
         */
        private int typeDetectionSize = 100;

        /**
         * Data rows read when looking up relationship ids against labels.
         */
        private int lookupRows = 5;

        /**
         * Distinct ids looked up per relationship side.
         */
        private int maxLookupIds = 10;
    }

    @Getter
    @Setter
    public static class TimeoutConfig {

        /**
         * Enqueue timeout in milliseconds.
         */
        private long enqueueMs = 5000;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 100;
    }
}
