package com.graphload.core.service.ingest;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.csv.IdentifierCoercion;
import com.graphload.core.service.csv.ParsedCsv;
import com.graphload.core.service.csv.TypedRow;
import com.graphload.core.service.csv.ValueConverter;
import com.graphload.core.service.persistence.GraphStore;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.TaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Handler for node file work items.
 *
 * Upserts one node per row, keyed by the row's identifier and the dataset
 * tag. With cascade delete on, nodes of the label that the file no longer
 * lists are removed after the last batch, together with their relationships.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NodeFileIngestor implements IngestionHandler<IngestionWorkItem.NodeFileWorkItem> {

    private final IngestionPipeline pipeline;
    private final GraphStore graphStore;
    private final TaskStore taskStore;
    private final GraphLoadConfig config;

    @Override
    public IngestionOutcome handle(IngestionWorkItem.NodeFileWorkItem workItem) {
        log.debug("Processing node file task {}", workItem.taskId());
        return pipeline.run(workItem.taskId(), FileKind.NODE, this::ingest);
    }

    IngestionResult ingest(IngestionContext context) {
        String label = labelOf(context);
        var csv = context.csv();
        long datasetId = context.datasetId();

        var nodes = new ArrayList<Map<String, Object>>(csv.rowCount());
        var ids = new LinkedHashSet<Object>();
        for (TypedRow row : csv.rows()) {
            Object id = IdentifierCoercion.coerce(row.get(csv.header().idColumn()));
            if (id == null) {
                context.warnings().skip("Row %d: Empty 'id' value".formatted(row.rowNumber()));
                continue;
            }
            ids.add(id);
            nodes.add(properties(row, id, csv, datasetId));
        }

        var written = new long[2];
        context.batches().forEachBatch(nodes, csv.rowCount(), (batch, batchNumber) -> {
            var result = graphStore.upsertNodes(label, batch);
            written[0] += result.written();
            written[1] += result.created();
        });

        long deleted = 0;
        if (context.dataset().isCascadeDelete()) {
            deleted = graphStore.deleteNodesNotIn(label, ids, datasetId);
        }

        long delta = written[1] - deleted;
        // DETACH DELETE also dropped the relationships of the removed nodes
        Long relationships = deleted > 0 ? graphStore.countRelationships(null, datasetId) : null;
        taskStore.updateDataset(datasetId, dataset -> {
            dataset.setTotalNodes(Math.max(0, dataset.getTotalNodes() + delta));
            if (relationships != null) {
                dataset.setTotalRelationships(relationships);
            }
        });
        log.info("Node file {} ingested into :{} of dataset {}: {} written, {} created, {} deleted",
                context.task().getFileName(), label, datasetId, written[0], written[1], deleted);

        var counts = new LinkedHashMap<String, Object>();
        counts.put("nodes_written", written[0]);
        counts.put("nodes_created", written[1]);
        counts.put("nodes_deleted", deleted);
        counts.put("rows_skipped", context.warnings().skippedRows());
        return new IngestionResult("Successfully ingested %d nodes (%d new)".formatted(written[0], written[1]),
                counts, written[0]);
    }

    private Map<String, Object> properties(TypedRow row, Object id, ParsedCsv csv, long datasetId) {
        var properties = new LinkedHashMap<String, Object>();
        for (var entry : row.values().entrySet()) {
            if (csv.header().isIdentifierColumn(entry.getKey())) {
                continue;
            }
            Object value = ValueConverter.convert(entry.getValue(), csv.column(entry.getKey()));
            if (value != null) {
                properties.put(entry.getKey(), value);
            }
        }
        properties.put(config.getGraph().getIdProperty(), id);
        properties.put(config.getGraph().getDatasetProperty(), datasetId);
        return properties;
    }

    private String labelOf(IngestionContext context) {
        String label = context.task().getNodeLabel();
        return label == null || label.isBlank() ? config.getGraph().getDefaultNodeLabel() : label;
    }
}
