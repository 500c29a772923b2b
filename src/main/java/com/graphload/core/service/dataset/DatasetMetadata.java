package com.graphload.core.service.dataset;

import java.util.List;
import java.util.Map;

/**
 * What the graph holds for one dataset: node counts and property keys per
 * label, relationship counts per type.
 */
public record DatasetMetadata(
        long datasetId,
        String datasetName,
        Map<String, LabelMetadata> nodeLabels,
        Map<String, RelationshipTypeMetadata> relationshipTypes,
        long totalNodes,
        long totalRelationships
) {

    public record LabelMetadata(long count, List<String> properties) {
    }

    public record RelationshipTypeMetadata(long count) {
    }
}
