package com.graphload.core.service.resolve;

import com.graphload.core.service.csv.TypedRow;

import java.util.List;

/**
 * Input of one relationship file's label resolution.
 *
 * @param declaredSource label from a {@code Label:source_id} header cell or stored on the task, may be null
 * @param declaredTarget label from a {@code Label:target_id} header cell or stored on the task, may be null
 * @param sampleRows leading data rows, used for existence lookups
 * @param knownLabels node labels available in the dataset, in upload order
 */
public record LabelResolutionRequest(
        long datasetId,
        String relationshipType,
        String declaredSource,
        String declaredTarget,
        List<TypedRow> sampleRows,
        String sourceColumn,
        String targetColumn,
        List<String> knownLabels
) {

    public LabelResolutionRequest {
        sampleRows = List.copyOf(sampleRows);
        knownLabels = List.copyOf(knownLabels);
    }
}
