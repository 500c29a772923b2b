package com.graphload.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Overall application configuration for Graph Load Core Service.
 *
 * Contains feature flags, upload storage, graph property naming and the
 * Neo4j connection settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphload")
public class GraphLoadConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Where uploaded CSV files are kept until their task finishes.
     */
    private UploadConfig upload = new UploadConfig();

    /**
     * Property names stamped on every ingested node and relationship.
     */
    private GraphConfig graph = new GraphConfig();

    /**
     * Neo4j connection settings.
     */
    private Neo4jConfig neo4j = new Neo4jConfig();

    @Getter
    @Setter
    public static class Features {

        /**
         * Delete the uploaded file once its task reaches a terminal state.
         */
        private boolean cleanupUploadedFiles = true;

        /**
         * Ask the graph store for dataset labels when no node task is known locally.
         */
        private boolean schemaLabelFallbackEnabled = true;

        /**
         * Record a task warning when relationship labels were assigned by default.
         */
        private boolean lowConfidenceWarningsEnabled = true;
    }

    @Getter
    @Setter
    public static class UploadConfig {

        /**
         * Directory for uploaded files (default: system temp dir).
         */
        private String directory = System.getProperty("java.io.tmpdir") + "/graphload-uploads";
    }

    @Getter
    @Setter
    public static class GraphConfig {

        /**
         * Property holding the entity identifier.
         */
        private String idProperty = "id";

        /**
         * Property holding the dataset tag.
         */
        private String datasetProperty = "dataset_id";

        /**
         * Label used when a node task carries none.
         */
        private String defaultNodeLabel = "Node";

        /**
         * Relationship type used when a relationship task carries none.
         */
        private String defaultRelationshipType = "RELATED_TO";
    }

    @Getter
    @Setter
    public static class Neo4jConfig {

        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "password";

        /**
         * Target database, empty for the server default.
         */
        private String database = "";

        /**
         * Transaction timeout applied to every graph-store call.
         */
        private Duration queryTimeout = Duration.ofSeconds(60);

        /**
         * Maximum driver connection pool size.
         */
        private int maxConnectionPoolSize = 50;
    }
}
