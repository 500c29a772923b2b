package com.graphload.core.service.api.controller;

import com.graphload.core.service.api.dto.ApiResponse;
import com.graphload.core.service.api.dto.CreateDatasetRequest;
import com.graphload.core.service.api.dto.DatasetResponse;
import com.graphload.core.service.api.dto.TaskResponse;
import com.graphload.core.service.dataset.DatasetMetadata;
import com.graphload.core.service.dataset.DatasetService;
import com.graphload.core.service.ingest.IngestionService;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.TaskStatus;
import com.graphload.core.service.task.TaskStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Controller for datasets and their file uploads.
 */
@Slf4j
@RestController
@RequestMapping("/datasets")
@Tag(name = "Datasets", description = "Endpoints for creating datasets and uploading CSV files")
@RequiredArgsConstructor
public class DatasetController {

    private final IngestionService ingestionService;
    private final DatasetService datasetService;
    private final TaskStore taskStore;

    @PostMapping
    @Operation(summary = "Create a dataset", description = "Creates an empty dataset that uploaded files are ingested into")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Dataset created"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<ApiResponse<DatasetResponse>> createDataset(
            @Valid @RequestBody CreateDatasetRequest request) {
        var dataset = datasetService.createDataset(request.getName(), request.getDescription(),
                request.isCascadeDelete());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(DatasetResponse.from(dataset)));
    }

    @GetMapping
    @Operation(summary = "List datasets", description = "Returns every dataset, newest first")
    public ResponseEntity<ApiResponse<List<DatasetResponse>>> listDatasets() {
        var datasets = datasetService.listDatasets().stream()
                .map(DatasetResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(datasets));
    }

    @GetMapping("/{datasetId}")
    @Operation(summary = "Get dataset", description = "Returns the dataset with its aggregate status and counts")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Dataset found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Dataset not found")
    })
    public ResponseEntity<ApiResponse<DatasetResponse>> getDataset(
            @Parameter(description = "Dataset ID") @PathVariable long datasetId) {
        log.debug("Getting dataset: {}", datasetId);
        return ResponseEntity.ok(ApiResponse.success(DatasetResponse.from(taskStore.getDataset(datasetId))));
    }

    @GetMapping("/{datasetId}/metadata")
    @Operation(summary = "Get dataset graph metadata",
               description = "Node counts and property keys per label and relationship counts per type, "
                       + "read from the graph for elements tagged with the dataset")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Metadata read"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Dataset not found")
    })
    public ResponseEntity<ApiResponse<DatasetMetadata>> getMetadata(
            @Parameter(description = "Dataset ID") @PathVariable long datasetId) {
        return ResponseEntity.ok(ApiResponse.success(datasetService.describe(datasetId)));
    }

    @DeleteMapping("/{datasetId}")
    @Operation(summary = "Delete a dataset",
               description = "Removes the dataset and its upload tasks. Nodes and relationships already written stay in the graph.")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "204", description = "Dataset deleted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Dataset not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Files still in progress")
    })
    public ResponseEntity<Void> deleteDataset(
            @Parameter(description = "Dataset ID") @PathVariable long datasetId) {
        datasetService.delete(datasetId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{datasetId}/tasks")
    @Operation(summary = "List upload tasks", description = "Returns the dataset's tasks in upload order")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> listTasks(
            @Parameter(description = "Dataset ID") @PathVariable long datasetId,
            @Parameter(description = "File kind filter") @RequestParam(required = false) FileKind kind,
            @Parameter(description = "Status filter") @RequestParam(required = false) TaskStatus status) {
        taskStore.getDataset(datasetId);
        var statuses = status == null ? new TaskStatus[0] : new TaskStatus[]{status};
        var tasks = taskStore.listByDataset(datasetId, kind, statuses).stream()
                .map(TaskResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    /**
     * Uploads one CSV file.
     *
     * @return 202 Accepted with the queued task, 429 if the queue is full
     */
    @PostMapping(path = "/{datasetId}/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Upload a CSV file",
            description = "Queues a node or relationship file for ingestion. The kind is detected from the header; "
                    + "the label or relationship type defaults to the file name without extension."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "File accepted for processing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid upload"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Dataset not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Ingestion queue full")
    })
    public ResponseEntity<ApiResponse<TaskResponse>> uploadFile(
            @Parameter(description = "Dataset ID") @PathVariable long datasetId,
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Node label or relationship type, overrides the file name")
            @RequestParam(required = false) String label) {
        log.debug("Received file {} for dataset {}", file.getOriginalFilename(), datasetId);

        var task = ingestionService.upload(datasetId, file, label);
        return ResponseEntity.accepted()
                .body(ApiResponse.success(TaskResponse.from(task)));
    }
}
