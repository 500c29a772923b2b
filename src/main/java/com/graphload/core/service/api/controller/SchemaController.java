package com.graphload.core.service.api.controller;

import com.graphload.core.service.api.dto.ApiResponse;
import com.graphload.core.service.persistence.GraphSchema;
import com.graphload.core.service.persistence.GraphStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for graph schema introspection.
 */
@Slf4j
@RestController
@Tag(name = "Graph Schema", description = "Labels, relationship types and property keys of the graph")
@RequiredArgsConstructor
public class SchemaController {

    private final GraphStore graphStore;

    @GetMapping("/graph/schema")
    @Operation(summary = "Describe the graph schema",
               description = "Returns every label, every relationship type and the property keys seen per label")
    public ResponseEntity<ApiResponse<GraphSchema>> describeSchema() {
        var schema = graphStore.describeSchema();
        log.debug("Schema: {} labels, {} relationship types", schema.labels().size(), schema.relationshipTypes().size());
        return ResponseEntity.ok(ApiResponse.success(schema));
    }
}
