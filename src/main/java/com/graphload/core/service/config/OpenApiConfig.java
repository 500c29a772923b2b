package com.graphload.core.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 */
@Configuration
public class OpenApiConfig {

    private static final String CSV_FORMATS = """
            Node files carry an `id` column; relationship files carry `source_id` and `target_id`, \
            optionally prefixed with the endpoint label as `Label:source_id`. Every other column \
            becomes a property whose type is inferred from the values.""";

    @Value("${server.port:8080}")
    private int serverPort;

    @Value("${spring.application.name:graphload-core-service}")
    private String applicationName;

    @Bean
    public OpenAPI graphLoadServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Graph Load Core Service API")
                        .description("Uploads node and relationship CSV files into datasets, validates them "
                                + "and ingests them into the property graph with live progress. " + CSV_FORMATS)
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Datasets").description("Datasets and their CSV uploads"),
                        new Tag().name("Upload Tasks").description("One task per uploaded file"),
                        new Tag().name("Graph Schema").description("What the graph currently holds")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description(applicationName + " (local)")
                ));
    }
}
