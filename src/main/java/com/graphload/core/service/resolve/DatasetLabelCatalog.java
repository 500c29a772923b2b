package com.graphload.core.service.resolve;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.persistence.GraphStore;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.TaskStatus;
import com.graphload.core.service.task.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Node labels a dataset offers to relationship files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetLabelCatalog {

    private final TaskStore taskStore;
    private final GraphStore graphStore;
    private final GraphLoadConfig config;

    /**
     * Labels of the dataset's node tasks that have not failed, in upload order.
     * Falls back to the labels found on the dataset's nodes in the graph when there are none.
     */
    public List<String> knownLabels(long datasetId) {
        var labels = new LinkedHashSet<String>();
        taskStore.listByDataset(datasetId, FileKind.NODE,
                        TaskStatus.PENDING, TaskStatus.PROCESSING, TaskStatus.COMPLETED)
                .forEach(task -> {
                    if (task.getNodeLabel() != null) {
                        labels.add(task.getNodeLabel());
                    }
                });

        if (labels.isEmpty() && config.getFeatures().isSchemaLabelFallbackEnabled()) {
            var fromGraph = graphStore.labelsForDataset(datasetId);
            log.info("No node uploads recorded for dataset {}, using graph labels {}", datasetId, fromGraph);
            labels.addAll(fromGraph);
        }
        return List.copyOf(labels);
    }
}
