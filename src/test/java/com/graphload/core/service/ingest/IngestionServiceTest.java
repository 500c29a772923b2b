package com.graphload.core.service.ingest;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.csv.CsvParserFactory;
import com.graphload.core.service.notify.InMemoryProgressNotifier;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.InMemoryTaskStore;
import com.graphload.core.service.task.TaskStateMachine;
import com.graphload.core.service.task.TaskStatus;
import com.graphload.core.service.task.UploadTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @TempDir
    Path uploads;

    @Mock
    private IngestionQueue queue;

    private GraphLoadConfig config;
    private InMemoryTaskStore taskStore;
    private IngestionCancellation cancellation;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        config = new GraphLoadConfig();
        config.getUpload().setDirectory(uploads.toString());
        taskStore = new InMemoryTaskStore();
        cancellation = new IngestionCancellation();
        service = new IngestionService(taskStore, new TaskStateMachine(taskStore, new InMemoryProgressNotifier()),
                queue, cancellation, new CsvParserFactory(), new IngestionConfig(), config);
    }

    @Test
    @DisplayName("Should queue a node file labelled after its file name")
    void shouldQueueNodeFile() {
        when(queue.enqueue(any(), anyLong())).thenReturn(true);
        var dataset = taskStore.createDataset("people", null, false);

        var task = service.upload(dataset.getId(), csv("Person.csv", "id,name\n1,Alice\n"), null);

        assertThat(task.getKind()).isEqualTo(FileKind.NODE);
        assertThat(task.getNodeLabel()).isEqualTo("Person");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(Files.exists(Path.of(task.getFilePath()))).isTrue();

        var item = ArgumentCaptor.forClass(IngestionWorkItem.class);
        verify(queue).enqueue(item.capture(), anyLong());
        assertThat(item.getValue()).isInstanceOf(IngestionWorkItem.NodeFileWorkItem.class);
        assertThat(item.getValue().taskId()).isEqualTo(task.getId());
        assertThat(taskStore.getDataset(dataset.getId()).getTotalFiles()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should detect a relationship file from its header and keep declared labels")
    void shouldQueueRelationshipFile() {
        when(queue.enqueue(any(), anyLong())).thenReturn(true);
        var dataset = taskStore.createDataset("shop", null, false);

        var task = service.upload(dataset.getId(),
                csv("bought.csv", "Customer:source_id,Product:target_id\n1,2\n"), "PURCHASED");

        assertThat(task.getKind()).isEqualTo(FileKind.RELATIONSHIP);
        assertThat(task.getRelationshipType()).isEqualTo("PURCHASED");
        assertThat(task.getSourceLabel()).isEqualTo("Customer");
        assertThat(task.getTargetLabel()).isEqualTo("Product");
    }

    @Test
    @DisplayName("Should turn a file name into a valid label")
    void shouldNormalizeFileNameLabel() {
        when(queue.enqueue(any(), anyLong())).thenReturn(true);
        var dataset = taskStore.createDataset("people", null, false);

        var task = service.upload(dataset.getId(), csv("my people (2).csv", "id\n1\n"), null);

        assertThat(task.getNodeLabel()).isEqualTo("my_people_2");
    }

    @Test
    @DisplayName("Should fail the task and remove the file when the queue is full")
    void shouldRejectWhenQueueFull() {
        when(queue.enqueue(any(), anyLong())).thenReturn(false);
        var dataset = taskStore.createDataset("people", null, false);

        assertThatThrownBy(() -> service.upload(dataset.getId(), csv("Person.csv", "id\n1\n"), null))
                .isInstanceOf(IngestionException.class)
                .extracting("errorCode").isEqualTo(IngestionException.QUEUE_FULL);

        var task = taskStore.listByDataset(dataset.getId(), null).get(0);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(Files.exists(Path.of(task.getFilePath()))).isFalse();
    }

    @Test
    @DisplayName("Should refuse uploads to an unknown dataset")
    void shouldRejectUnknownDataset() {
        assertThatThrownBy(() -> service.upload(42L, csv("Person.csv", "id\n1\n"), null))
                .isInstanceOf(IngestionException.class)
                .extracting("errorCode").isEqualTo(IngestionException.DATASET_NOT_FOUND);
        verify(queue, never()).enqueue(any(), anyLong());
    }

    @Test
    @DisplayName("Should reject a header label that is not a valid identifier")
    void shouldRejectInvalidDeclaredLabel() {
        var dataset = taskStore.createDataset("shop", null, false);

        assertThatThrownBy(() -> service.upload(dataset.getId(),
                csv("rel.csv", "Bad Label:source_id,target_id\n1,2\n"), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(taskStore.listByDataset(dataset.getId(), null)).isEmpty();
    }

    @Test
    @DisplayName("Should fail a pending task on cancel and refuse to cancel it twice")
    void shouldCancelPendingTask() {
        when(queue.enqueue(any(), anyLong())).thenReturn(true);
        var dataset = taskStore.createDataset("people", null, false);
        var task = service.upload(dataset.getId(), csv("Person.csv", "id\n1\n"), null);

        var cancelled = service.cancel(task.getId());

        assertThat(cancelled.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(cancelled.getErrorMessage()).isEqualTo("Ingestion cancelled");
        assertThat(cancellation.isCancelled(task.getId())).isFalse();
        verify(queue).remove(task.getId());
        assertThatThrownBy(() -> service.cancel(task.getId())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should remove the stored file of a cancelled pending task")
    void shouldDeleteFileOfCancelledTask() {
        when(queue.enqueue(any(), anyLong())).thenReturn(true);
        var dataset = taskStore.createDataset("people", null, false);
        var task = service.upload(dataset.getId(), csv("Person.csv", "id\n1\n"), null);

        service.cancel(task.getId());

        assertThat(Files.exists(Path.of(task.getFilePath()))).isFalse();
    }

    @Test
    @DisplayName("Should keep the cancellation flag when a worker starts the task during cancel")
    void shouldKeepCancellationWhenTaskStartsDuringCancel() {
        var store = new InMemoryTaskStore() {
            private Runnable afterRead = () -> { };

            @Override
            public UploadTask getTask(long taskId) {
                var task = super.getTask(taskId);
                var hook = afterRead;
                afterRead = () -> { };
                hook.run();
                return task;
            }
        };
        var stateMachine = new TaskStateMachine(store, new InMemoryProgressNotifier());
        var racingService = new IngestionService(store, stateMachine, queue, cancellation,
                new CsvParserFactory(), new IngestionConfig(), config);
        when(queue.enqueue(any(), anyLong())).thenReturn(true);
        var dataset = store.createDataset("people", null, false);
        var task = racingService.upload(dataset.getId(), csv("Person.csv", "id\n1\n"), null);

        store.afterRead = () -> stateMachine.start(task.getId());
        var result = racingService.cancel(task.getId());

        assertThat(result.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(result.getErrorMessage()).isNull();
        assertThat(cancellation.isCancelled(task.getId())).isTrue();
        assertThatThrownBy(() -> cancellation.throwIfCancelled(task.getId()))
                .isInstanceOf(IngestionException.class)
                .extracting("errorCode").isEqualTo(IngestionException.CANCELLED);
    }

    private static MockMultipartFile csv(String name, String content) {
        return new MockMultipartFile("file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }
}
