package com.graphload.core.service.ingest;

import com.graphload.core.service.config.MetricsConfig;
import com.graphload.core.service.task.TaskStateMachine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BatchRunnerTest {

    @Mock
    private TaskStateMachine stateMachine;

    private IngestionCancellation cancellation;
    private BatchRunner runner;

    @BeforeEach
    void setUp() {
        cancellation = new IngestionCancellation();
        runner = new BatchRunner(7L, 2, stateMachine, cancellation, new MetricsConfig(new SimpleMeterRegistry()));
    }

    @Test
    void shouldRunBatchesInOrderAndReportProgress() {
        var seen = new ArrayList<List<Integer>>();

        runner.forEachBatch(List.of(1, 2, 3, 4, 5), 5, (batch, number) -> seen.add(List.copyOf(batch)));

        assertThat(seen).containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
        verify(stateMachine).batchProgress(7L, 2, 5, 1, 3);
        verify(stateMachine).batchProgress(7L, 4, 5, 2, 3);
        verify(stateMachine).batchProgress(7L, 5, 5, 3, 3);
    }

    @Test
    void shouldProjectProgressOntoFileRowsWhenRowsWereSkipped() {
        runner.forEachBatch(List.of(1, 2), 4, (batch, number) -> { });

        verify(stateMachine).batchProgress(7L, 4, 4, 1, 1);
    }

    @Test
    void shouldWrapBatchFailuresWithTheBatchNumber() {
        assertThatThrownBy(() -> runner.forEachBatch(List.of(1, 2, 3), 3, (batch, number) -> {
            if (number == 2) {
                throw new IllegalStateException("boom");
            }
        }))
                .isInstanceOf(IngestionException.class)
                .hasMessage("Error processing batch 2: boom")
                .extracting("errorCode").isEqualTo(IngestionException.BATCH_FAILED);
    }

    @Test
    void shouldStopWhenCancelled() {
        cancellation.cancel(7L);

        assertThatThrownBy(() -> runner.forEachBatch(List.of(1), 1, (batch, number) -> { }))
                .isInstanceOf(IngestionException.class)
                .hasMessage("Ingestion cancelled");
        verify(stateMachine, never()).batchProgress(7L, 1, 1, 1, 1);
    }

    @Test
    void shouldRejectNonPositiveBatchSize() {
        assertThatThrownBy(() -> new BatchRunner(1L, 0, stateMachine, cancellation,
                new MetricsConfig(new SimpleMeterRegistry())))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
