package com.graphload.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Graph Load Core Service Application - Entry point for the Spring Boot application.
 *
 * Ingests uploaded node and relationship CSV files into a Neo4j property graph:
 * - Validates each file and infers its column types
 * - Resolves relationship endpoint labels against the dataset's nodes
 * - Writes rows in batches while publishing task progress
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.graphload.core.service.config")
public class GraphLoadCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphLoadCoreServiceApplication.class, args);
    }
}
