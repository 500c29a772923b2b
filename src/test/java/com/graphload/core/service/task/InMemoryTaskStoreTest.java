package com.graphload.core.service.task;

import com.graphload.core.service.ingest.IngestionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTaskStoreTest {

    private final InMemoryTaskStore store = new InMemoryTaskStore();

    @Test
    @DisplayName("Should assign increasing ids and count files per dataset")
    void shouldCreateTasks() {
        var dataset = store.createDataset("social", null, true);

        var nodes = store.createTask(NewUploadTask.nodeFile(dataset.getId(), "Person.csv", "/tmp/a", "Person"));
        var rels = store.createTask(NewUploadTask.relationshipFile(dataset.getId(), "KNOWS.csv", "/tmp/b",
                "KNOWS", "Person", null));

        assertThat(rels.getId()).isGreaterThan(nodes.getId());
        assertThat(nodes.getNodeLabel()).isEqualTo("Person");
        assertThat(nodes.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(rels.getRelationshipType()).isEqualTo("KNOWS");
        assertThat(rels.getSourceLabel()).isEqualTo("Person");
        assertThat(store.getDataset(dataset.getId()).getTotalFiles()).isEqualTo(2);
        assertThat(store.getDataset(dataset.getId()).isCascadeDelete()).isTrue();
    }

    @Test
    @DisplayName("Should hand out copies that do not change the stored record")
    void shouldReturnCopies() {
        var dataset = store.createDataset("social", null, false);
        var task = store.createTask(NewUploadTask.nodeFile(dataset.getId(), "Person.csv", "/tmp/a", "Person"));

        task.setStatus(TaskStatus.FAILED);
        task.getValidationWarnings().add("local only");

        var stored = store.getTask(task.getId());
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(stored.getValidationWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should filter tasks by kind and status in id order")
    void shouldListByDataset() {
        var dataset = store.createDataset("social", null, false);
        var other = store.createDataset("other", null, false);
        var first = store.createTask(NewUploadTask.nodeFile(dataset.getId(), "A.csv", "/tmp/a", "A"));
        var second = store.createTask(NewUploadTask.nodeFile(dataset.getId(), "B.csv", "/tmp/b", "B"));
        store.createTask(NewUploadTask.relationshipFile(dataset.getId(), "R.csv", "/tmp/r", "R", null, null));
        store.createTask(NewUploadTask.nodeFile(other.getId(), "C.csv", "/tmp/c", "C"));
        store.updateTask(second.getId(), task -> task.setStatus(TaskStatus.FAILED));

        assertThat(store.listByDataset(dataset.getId(), null)).hasSize(3);
        assertThat(store.listByDataset(dataset.getId(), FileKind.NODE, TaskStatus.PENDING))
                .extracting(UploadTask::getId)
                .containsExactly(first.getId());
    }

    @Test
    @DisplayName("Should list datasets newest first")
    void shouldListDatasetsNewestFirst() {
        var first = store.createDataset("first", null, false);
        var second = store.createDataset("second", null, false);
        var third = store.createDataset("third", null, false);

        assertThat(store.listDatasets())
                .extracting(Dataset::getId)
                .containsExactly(third.getId(), second.getId(), first.getId());
    }

    @Test
    @DisplayName("Should delete a dataset together with its task records")
    void shouldDeleteDatasetWithTasks() {
        var dataset = store.createDataset("social", null, false);
        var other = store.createDataset("other", null, false);
        var task = store.createTask(NewUploadTask.nodeFile(dataset.getId(), "A.csv", "/tmp/a", "A"));
        var kept = store.createTask(NewUploadTask.nodeFile(other.getId(), "B.csv", "/tmp/b", "B"));

        var removed = store.deleteDataset(dataset.getId());

        assertThat(removed).extracting(UploadTask::getId).containsExactly(task.getId());
        assertThat(store.findDataset(dataset.getId())).isEmpty();
        assertThat(store.findTask(task.getId())).isEmpty();
        assertThat(store.findTask(kept.getId())).isPresent();
        assertThat(store.listDatasets()).extracting(Dataset::getId).containsExactly(other.getId());
        assertThatThrownBy(() -> store.deleteDataset(dataset.getId()))
                .isInstanceOf(IngestionException.class)
                .extracting("errorCode").isEqualTo(IngestionException.DATASET_NOT_FOUND);
    }

    @Test
    @DisplayName("Should report unknown ids with not-found errors")
    void shouldRejectUnknownIds() {
        assertThatThrownBy(() -> store.getTask(42))
                .isInstanceOf(IngestionException.class)
                .extracting("errorCode").isEqualTo(IngestionException.TASK_NOT_FOUND);
        assertThatThrownBy(() -> store.updateDataset(42, dataset -> dataset.setTotalNodes(1)))
                .isInstanceOf(IngestionException.class)
                .extracting("errorCode").isEqualTo(IngestionException.DATASET_NOT_FOUND);
        assertThatThrownBy(() -> store.createTask(NewUploadTask.nodeFile(42, "A.csv", "/tmp/a", "A")))
                .isInstanceOf(IngestionException.class);
    }
}
