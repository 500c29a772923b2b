package com.graphload.core.service.persistence;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of the graph's labels, relationship types and property keys per label.
 */
public record GraphSchema(
        List<String> labels,
        List<String> relationshipTypes,
        Map<String, List<String>> propertyKeys
) {
}
