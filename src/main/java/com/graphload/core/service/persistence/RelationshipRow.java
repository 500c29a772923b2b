package com.graphload.core.service.persistence;

import java.util.Map;

/**
 * One relationship to merge between two existing nodes.
 *
 * @param sourceId coerced source node identifier
 * @param targetId coerced target node identifier
 * @param properties relationship properties, dataset tag included
 */
public record RelationshipRow(Object sourceId, Object targetId, Map<String, Object> properties) {
}
