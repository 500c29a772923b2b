package com.graphload.core.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Neo4j driver from {@code graphload.neo4j.*}.
 *
 * The driver connects lazily; connectivity is checked by the graph store on startup.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class Neo4jDriverConfig {

    private final GraphLoadConfig graphLoadConfig;

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver() {
        var neo4j = graphLoadConfig.getNeo4j();
        var config = Config.builder()
                .withMaxConnectionPoolSize(neo4j.getMaxConnectionPoolSize())
                .build();

        log.info("Creating Neo4j driver for {}", neo4j.getUri());
        return GraphDatabase.driver(
                neo4j.getUri(),
                AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()),
                config
        );
    }
}
