package com.graphload.core.service.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Graph database operations used by ingestion.
 *
 * Every node and relationship written through this interface carries the
 * dataset tag; reads and deletes are scoped by it. Labels and relationship
 * types must pass {@link CypherIdentifiers#sanitize(String)}.
 */
public interface GraphStore {

    /**
     * Merges nodes by identifier and dataset, replacing their properties.
     *
     * @param nodes property maps, each holding the identifier and dataset tag
     */
    UpsertResult upsertNodes(String label, List<Map<String, Object>> nodes);

    /**
     * Merges one relationship per endpoint pair, replacing its properties.
     * Rows whose endpoints do not exist are not written.
     */
    UpsertResult upsertRelationships(String sourceLabel, String targetLabel, String type,
                                     List<RelationshipRow> rows, long datasetId);

    /**
     * @return the subset of {@code ids} present as nodes of the label in the dataset
     */
    Set<Object> findExistingNodeIds(String label, Collection<?> ids, long datasetId);

    /**
     * Deletes, with their relationships, the dataset's nodes of the label whose identifier is not listed.
     *
     * @return number of nodes deleted
     */
    long deleteNodesNotIn(String label, Collection<?> ids, long datasetId);

    /**
     * @return number of relationships deleted
     */
    long deleteRelationshipsOfType(String type, long datasetId);

    /**
     * @param type relationship type, null for every type
     */
    long countRelationships(String type, long datasetId);

    long countNodes(String label, long datasetId);

    /**
     * Types of the relationships tagged with the dataset, sorted.
     */
    List<String> relationshipTypesForDataset(long datasetId);

    /**
     * Property keys of the dataset's nodes of the label, sorted.
     */
    List<String> propertyKeys(String label, long datasetId);

    /**
     * Labels carried by nodes tagged with the dataset, sorted.
     */
    List<String> labelsForDataset(long datasetId);

    GraphSchema describeSchema();
}
