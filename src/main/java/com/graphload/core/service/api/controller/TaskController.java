package com.graphload.core.service.api.controller;

import com.graphload.core.service.api.dto.ApiResponse;
import com.graphload.core.service.api.dto.TaskResponse;
import com.graphload.core.service.ingest.IngestionQueue;
import com.graphload.core.service.ingest.IngestionService;
import com.graphload.core.service.notify.InMemoryProgressNotifier;
import com.graphload.core.service.notify.ProgressEvent;
import com.graphload.core.service.task.TaskStatus;
import com.graphload.core.service.task.TaskStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Controller for upload task status, progress and cancellation.
 */
@Slf4j
@RestController
@RequestMapping("/tasks")
@Tag(name = "Upload Tasks", description = "Endpoints for following and cancelling file ingestion")
@RequiredArgsConstructor
public class TaskController {

    private final TaskStore taskStore;
    private final IngestionService ingestionService;
    private final InMemoryProgressNotifier notifier;
    private final IngestionQueue queue;

    @GetMapping("/{taskId}")
    @Operation(summary = "Get task", description = "Returns the task state, warnings and error details")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Task found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Task not found")
    })
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(
            @Parameter(description = "Task ID") @PathVariable long taskId) {
        return ResponseEntity.ok(ApiResponse.success(TaskResponse.from(taskStore.getTask(taskId))));
    }

    @GetMapping("/{taskId}/progress")
    @Operation(summary = "Get task progress", description = "Returns the last progress event published for the task, "
            + "and the queue position while it waits for a worker")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getProgress(
            @Parameter(description = "Task ID") @PathVariable long taskId) {
        var task = taskStore.getTask(taskId);

        var progress = new LinkedHashMap<String, Object>();
        progress.put("taskId", taskId);
        progress.put("percentage", task.getProgressPercentage());
        notifier.latest(taskId).ifPresent(event -> addEvent(progress, event));
        // the stored status wins over the one carried by the last event
        progress.put("status", task.getStatus().name().toLowerCase(Locale.ROOT));
        if (task.getStatus() == TaskStatus.PENDING) {
            queue.positionOf(taskId).ifPresent(position -> progress.put("queuePosition", position));
        }
        return ResponseEntity.ok(ApiResponse.success(progress));
    }

    @PostMapping("/{taskId}/cancel")
    @Operation(summary = "Cancel task", description = "Fails a pending task or stops a running one before its next batch")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Cancellation requested"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Task not found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Task already finished")
    })
    public ResponseEntity<ApiResponse<TaskResponse>> cancelTask(
            @Parameter(description = "Task ID") @PathVariable long taskId) {
        var task = ingestionService.cancel(taskId);
        log.info("Cancellation requested for task {} ({})", taskId, task.getStatus());
        return ResponseEntity.accepted().body(ApiResponse.success(TaskResponse.from(task)));
    }

    private static void addEvent(Map<String, Object> progress, ProgressEvent event) {
        progress.put("event", event.type().name().toLowerCase(Locale.ROOT));
        progress.putAll(event.data());
        progress.put("updatedAt", event.timestamp());
    }
}
