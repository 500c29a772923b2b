package com.graphload.core.service.task;

import com.graphload.core.service.notify.EventType;
import com.graphload.core.service.notify.InMemoryProgressNotifier;
import com.graphload.core.service.notify.ProgressEvent;
import com.graphload.core.service.notify.ProgressNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskStateMachineTest {

    private InMemoryTaskStore taskStore;
    private InMemoryProgressNotifier notifier;
    private TaskStateMachine stateMachine;
    private long datasetId;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskStore();
        notifier = new InMemoryProgressNotifier();
        stateMachine = new TaskStateMachine(taskStore, notifier);
        datasetId = taskStore.createDataset("people", "test data", false).getId();
    }

    // ==================== Transitions ====================

    @Test
    @DisplayName("Should move a task from pending to processing to completed")
    void shouldRunHappyPath() {
        long taskId = newTask();
        var events = subscribe(taskId);

        stateMachine.start(taskId);
        var completed = stateMachine.complete(taskId, "Successfully ingested 2 nodes (2 new)",
                Map.of("nodes_written", 2L), List.of("Row 3: Empty 'id' value"));

        assertThat(completed.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(completed.getStartedAt()).isNotNull();
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(completed.getProgressPercentage()).isEqualTo(100.0);
        assertThat(completed.getValidationWarnings()).containsExactly("Row 3: Empty 'id' value");

        assertThat(events).extracting(ProgressEvent::type).containsExactly(EventType.STATUS, EventType.STATUS);
        assertThat(events.get(1).data())
                .containsEntry("status", "completed")
                .containsEntry("percentage", 100)
                .containsEntry("nodes_written", 2L);
    }

    @Test
    @DisplayName("Should fail a task with its error details and publish an error event")
    void shouldFailTask() {
        long taskId = newTask();
        stateMachine.start(taskId);

        var failed = stateMachine.fail(taskId, "CSV validation failed",
                Map.of("errors", List.of("Empty file")));

        assertThat(failed.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo("CSV validation failed");
        assertThat(failed.getErrorDetails()).containsEntry("errors", List.of("Empty file"));
        assertThat(notifier.latest(taskId)).hasValueSatisfying(event -> {
            assertThat(event.type()).isEqualTo(EventType.ERROR);
            assertThat(event.data()).containsEntry("errors", List.of("Empty file"));
        });
    }

    @Test
    @DisplayName("Should fail a pending task directly")
    void shouldFailPendingTask() {
        long taskId = newTask();

        assertThat(stateMachine.fail(taskId, "Ingestion cancelled", Map.of()).getStatus())
                .isEqualTo(TaskStatus.FAILED);
    }

    @Test
    @DisplayName("Should reject transitions out of terminal states")
    void shouldRejectTerminalTransitions() {
        long taskId = newTask();
        stateMachine.start(taskId);
        stateMachine.complete(taskId, "done", Map.of(), List.of());

        assertThatThrownBy(() -> stateMachine.fail(taskId, "late", Map.of()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> stateMachine.start(taskId))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("COMPLETED");
        assertThat(taskStore.getTask(taskId).getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should reject completing a task that never started")
    void shouldRejectCompletingPendingTask() {
        long taskId = newTask();

        assertThatThrownBy(() -> stateMachine.complete(taskId, "done", Map.of(), List.of()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should keep transitions working when the notifier throws")
    void shouldIgnoreNotifierFailures() {
        ProgressNotifier broken = (taskId, type, payload) -> {
            throw new IllegalStateException("subscriber gone");
        };
        var machine = new TaskStateMachine(taskStore, broken);
        long taskId = newTask();

        assertThat(machine.start(taskId).getStatus()).isEqualTo(TaskStatus.PROCESSING);
    }

    // ==================== Progress ====================

    @Test
    @DisplayName("Should map batch progress into the 10 to 90 percent band")
    void shouldReportBatchProgress() {
        long taskId = newTask();
        stateMachine.start(taskId);

        stateMachine.batchProgress(taskId, 50, 100, 1, 2);

        var task = taskStore.getTask(taskId);
        assertThat(task.getProcessedRows()).isEqualTo(50);
        assertThat(task.getTotalRows()).isEqualTo(100);
        assertThat(task.getProgressPercentage()).isEqualTo(50.0);
        assertThat(notifier.latest(taskId)).hasValueSatisfying(event ->
                assertThat(event.data()).containsEntry("message", "Processing batch 1/2"));
    }

    @Test
    @DisplayName("Should bound the batch percentage")
    void shouldBoundBatchPercentage() {
        assertThat(ProgressCalculator.batchPercentage(0, 10)).isEqualTo(10);
        assertThat(ProgressCalculator.batchPercentage(10, 10)).isEqualTo(90);
        assertThat(ProgressCalculator.batchPercentage(15, 10)).isEqualTo(90);
        assertThat(ProgressCalculator.batchPercentage(0, 0)).isEqualTo(90);
    }

    // ==================== Dataset Aggregate ====================

    @Test
    @DisplayName("Should derive the dataset status from its tasks")
    void shouldAggregateDatasetStatus() {
        assertThat(stateMachine.refreshDatasetStatus(datasetId)).isEqualTo(TaskStatus.PENDING);

        long first = newTask();
        long second = newTask();
        stateMachine.start(first);
        assertThat(taskStore.getDataset(datasetId).getStatus()).isEqualTo(TaskStatus.PROCESSING);

        stateMachine.complete(first, "done", Map.of(), List.of());
        assertThat(taskStore.getDataset(datasetId).getStatus()).isEqualTo(TaskStatus.PROCESSING);

        stateMachine.start(second);
        stateMachine.complete(second, "done", Map.of(), List.of());
        var dataset = taskStore.getDataset(datasetId);
        assertThat(dataset.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(dataset.getProcessedFiles()).isEqualTo(2);
        assertThat(dataset.getTotalFiles()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should mark the dataset failed when any task failed")
    void shouldAggregateFailure() {
        long first = newTask();
        newTask();

        stateMachine.fail(first, "broken", Map.of());

        assertThat(taskStore.getDataset(datasetId).getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(taskStore.getDataset(datasetId).getProcessedFiles()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should settle the dataset as completed when two files finish concurrently")
    void shouldAggregateConcurrentCompletions() throws InterruptedException {
        var slowWorkerWaiting = new CountDownLatch(1);
        var releaseSlowWorker = new CountDownLatch(1);
        var store = new InMemoryTaskStore() {
            @Override
            public Dataset updateDataset(long id, Consumer<Dataset> mutation) {
                if ("slow-worker".equals(Thread.currentThread().getName())) {
                    slowWorkerWaiting.countDown();
                    awaitQuietly(releaseSlowWorker);
                }
                return super.updateDataset(id, mutation);
            }
        };
        var machine = new TaskStateMachine(store, new InMemoryProgressNotifier());
        long dataset = store.createDataset("shop", null, false).getId();
        long first = store.createTask(NewUploadTask.nodeFile(dataset, "A.csv", "/tmp/A.csv", "A")).getId();
        long second = store.createTask(NewUploadTask.nodeFile(dataset, "B.csv", "/tmp/B.csv", "B")).getId();
        machine.start(first);
        machine.start(second);

        var slow = new Thread(() -> machine.complete(first, "done", Map.of(), List.of()), "slow-worker");
        slow.start();
        assertThat(slowWorkerWaiting.await(5, TimeUnit.SECONDS)).isTrue();

        machine.complete(second, "done", Map.of(), List.of());
        releaseSlowWorker.countDown();
        slow.join(5_000);

        assertThat(store.getTask(first).getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(store.getDataset(dataset).getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(store.getDataset(dataset).getProcessedFiles()).isEqualTo(2);
    }

    // ==================== Pending Failure ====================

    @Test
    @DisplayName("Should fail a task that is still pending")
    void shouldFailIfPending() {
        long taskId = newTask();

        var failed = stateMachine.failIfPending(taskId, "Ingestion cancelled", Map.of());

        assertThat(failed).hasValueSatisfying(task -> {
            assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
            assertThat(task.getErrorMessage()).isEqualTo("Ingestion cancelled");
        });
        assertThat(taskStore.getDataset(datasetId).getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    @DisplayName("Should leave a started task alone when failing it as pending")
    void shouldNotFailStartedTaskAsPending() {
        long taskId = newTask();
        stateMachine.start(taskId);

        assertThat(stateMachine.failIfPending(taskId, "Ingestion cancelled", Map.of())).isEmpty();

        var task = taskStore.getTask(taskId);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getErrorMessage()).isNull();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private long newTask() {
        return taskStore.createTask(NewUploadTask.nodeFile(datasetId, "Person.csv", "/tmp/Person.csv", "Person"))
                .getId();
    }

    private List<ProgressEvent> subscribe(long taskId) {
        var events = new ArrayList<ProgressEvent>();
        notifier.subscribe(taskId, events::add);
        return events;
    }
}
