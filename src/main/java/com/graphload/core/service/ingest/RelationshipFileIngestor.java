package com.graphload.core.service.ingest;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.csv.CsvHeader;
import com.graphload.core.service.csv.IdentifierCoercion;
import com.graphload.core.service.csv.ParsedCsv;
import com.graphload.core.service.csv.TypedRow;
import com.graphload.core.service.csv.ValueConverter;
import com.graphload.core.service.persistence.GraphStore;
import com.graphload.core.service.persistence.RelationshipRow;
import com.graphload.core.service.resolve.DatasetLabelCatalog;
import com.graphload.core.service.resolve.LabelResolution;
import com.graphload.core.service.resolve.LabelResolutionRequest;
import com.graphload.core.service.resolve.LabelResolver;
import com.graphload.core.service.task.FileKind;
import com.graphload.core.service.task.ProgressCalculator;
import com.graphload.core.service.task.TaskStateMachine;
import com.graphload.core.service.task.TaskStore;
import com.graphload.core.service.task.UploadTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Handler for relationship file work items.
 *
 * Resolves the endpoint labels, then for every batch asks the graph store
 * which endpoints exist and upserts only the rows whose two endpoints do.
 * With cascade delete on, the dataset's relationships of the type are
 * removed before the first batch so the file replaces them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationshipFileIngestor implements IngestionHandler<IngestionWorkItem.RelationshipFileWorkItem> {

    private final IngestionPipeline pipeline;
    private final LabelResolver labelResolver;
    private final DatasetLabelCatalog labelCatalog;
    private final GraphStore graphStore;
    private final TaskStore taskStore;
    private final TaskStateMachine stateMachine;
    private final IngestionConfig ingestionConfig;
    private final GraphLoadConfig config;

    @Override
    public IngestionOutcome handle(IngestionWorkItem.RelationshipFileWorkItem workItem) {
        log.debug("Processing relationship file task {}", workItem.taskId());
        return pipeline.run(workItem.taskId(), FileKind.RELATIONSHIP, this::ingest);
    }

    IngestionResult ingest(IngestionContext context) {
        var csv = context.csv();
        long taskId = context.taskId();
        long datasetId = context.datasetId();
        String type = typeOf(context.task());

        var resolution = resolveLabels(context, type);
        context.warnings().addAll(resolution.warnings());
        String sourceLabel = resolution.sourceLabel();
        String targetLabel = resolution.targetLabel();

        if (context.dataset().isCascadeDelete()) {
            stateMachine.progress(taskId, "Syncing to file (removing previous relationships)...",
                    ProgressCalculator.SYNCING);
            graphStore.deleteRelationshipsOfType(type, datasetId);
        }

        var rows = new ArrayList<NumberedRow>(csv.rowCount());
        for (TypedRow row : csv.rows()) {
            Object sourceId = IdentifierCoercion.coerce(row.get(csv.header().sourceColumn()));
            Object targetId = IdentifierCoercion.coerce(row.get(csv.header().targetColumn()));
            if (sourceId == null || targetId == null) {
                context.warnings().skip("Row %d: Missing source_id or target_id".formatted(row.rowNumber()));
                continue;
            }
            rows.add(new NumberedRow(row.rowNumber(),
                    new RelationshipRow(sourceId, targetId, properties(row, csv, datasetId))));
        }

        var created = new long[1];
        context.batches().forEachBatch(rows, csv.rowCount(), (batch, batchNumber) -> {
            var sourceIds = new LinkedHashSet<Object>();
            var targetIds = new LinkedHashSet<Object>();
            for (var numbered : batch) {
                sourceIds.add(numbered.row().sourceId());
                targetIds.add(numbered.row().targetId());
            }
            Set<Object> existingSources = graphStore.findExistingNodeIds(sourceLabel, sourceIds, datasetId);
            Set<Object> existingTargets = graphStore.findExistingNodeIds(targetLabel, targetIds, datasetId);

            var valid = new ArrayList<RelationshipRow>(batch.size());
            for (var numbered : batch) {
                var row = numbered.row();
                if (!existingSources.contains(row.sourceId())) {
                    context.warnings().skip("Row %d: Source node %s:%s does not exist"
                            .formatted(numbered.rowNumber(), sourceLabel, row.sourceId()));
                } else if (!existingTargets.contains(row.targetId())) {
                    context.warnings().skip("Row %d: Target node %s:%s does not exist"
                            .formatted(numbered.rowNumber(), targetLabel, row.targetId()));
                } else {
                    valid.add(row);
                }
            }
            created[0] += graphStore.upsertRelationships(sourceLabel, targetLabel, type, valid, datasetId).created();
        });

        long ofType = graphStore.countRelationships(type, datasetId);
        long total = graphStore.countRelationships(null, datasetId);
        taskStore.updateDataset(datasetId, dataset -> dataset.setTotalRelationships(total));
        log.info("Relationship file {} ingested as (:{})-[:{}]->(:{}) in dataset {}: {} created, {} of type, {} total",
                context.task().getFileName(), sourceLabel, type, targetLabel, datasetId, created[0], ofType, total);

        var counts = new LinkedHashMap<String, Object>();
        counts.put("relationships_created", created[0]);
        counts.put("relationships_of_type", ofType);
        counts.put("source_label", sourceLabel);
        counts.put("target_label", targetLabel);
        counts.put("rows_skipped", context.warnings().skippedRows());
        return new IngestionResult("Successfully created %d relationships".formatted(created[0]), counts, created[0]);
    }

    // ==================== Labels ====================

    private LabelResolution resolveLabels(IngestionContext context, String type) {
        var task = context.task();
        CsvHeader header = context.csv().header();
        String declaredSource = firstNonBlank(task.getSourceLabel(), header.declaredSourceLabel());
        String declaredTarget = firstNonBlank(task.getTargetLabel(), header.declaredTargetLabel());

        int lookupRows = ingestionConfig.getSampling().getLookupRows();
        var sample = context.csv().rows().subList(0, Math.min(lookupRows, context.csv().rowCount()));

        var request = new LabelResolutionRequest(context.datasetId(), type, declaredSource, declaredTarget,
                sample, header.sourceColumn(), header.targetColumn(), labelCatalog.knownLabels(context.datasetId()));
        var resolution = labelResolver.resolve(request);

        taskStore.updateTask(task.getId(), current -> {
            current.setSourceLabel(resolution.sourceLabel());
            current.setTargetLabel(resolution.targetLabel());
        });
        return resolution;
    }

    // ==================== Rows ====================

    private Map<String, Object> properties(TypedRow row, ParsedCsv csv, long datasetId) {
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
        properties.put(config.getGraph().getDatasetProperty(), datasetId);
        return properties;
    }

    private String typeOf(UploadTask task) {
        String type = task.getRelationshipType();
        return type == null || type.isBlank() ? config.getGraph().getDefaultRelationshipType() : type;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }

    private record NumberedRow(int rowNumber, RelationshipRow row) {
    }
}
