package com.graphload.core.service.persistence;

import com.graphload.core.service.config.GraphLoadConfig;
import org.springframework.stereotype.Component;

import static com.graphload.core.service.persistence.CypherIdentifiers.quote;
import static com.graphload.core.service.persistence.CypherIdentifiers.safe;

/**
 * Builds the parameterised Cypher statements issued by the graph store.
 *
 * Values always travel as parameters ({@code $rows}, {@code $ids},
 * {@code $dataset}); only sanitized labels, types and configured property
 * names are spliced into the text.
 */
@Component
public class CypherBuilder {

    public static final String ROWS = "rows";
    public static final String IDS = "ids";
    public static final String DATASET = "dataset";

    private final String idKey;
    private final String datasetKey;

    public CypherBuilder(GraphLoadConfig config) {
        this.idKey = safe(config.getGraph().getIdProperty());
        this.datasetKey = safe(config.getGraph().getDatasetProperty());
    }

    // ==================== Writes ====================

    /**
     * Expects {@code $rows}: property maps holding the identifier and dataset tag.
     */
    public String upsertNodes(String label) {
        return """
            UNWIND $rows AS row \
            MERGE (n:%s {%s: row.%s, %s: row.%s}) \
            SET n = row \
            RETURN count(n) AS written"""
                .formatted(safe(label), idKey, idKey, datasetKey, datasetKey);
    }

    /**
     * Expects {@code $rows}: maps of {@code source}, {@code target} and {@code props}; and {@code $dataset}.
     */
    public String upsertRelationships(String sourceLabel, String targetLabel, String type) {
        return """
            UNWIND $rows AS row \
            MATCH (s:%s {%s: row.source, %s: $dataset}) \
            MATCH (t:%s {%s: row.target, %s: $dataset}) \
            MERGE (s)-[r:%s]->(t) \
            SET r = row.props \
            RETURN count(r) AS written"""
                .formatted(safe(sourceLabel), idKey, datasetKey,
                        safe(targetLabel), idKey, datasetKey,
                        safe(type));
    }

    public String deleteNodesNotIn(String label) {
        return """
            MATCH (n:%s {%s: $dataset}) \
            WHERE NOT n.%s IN $ids \
            DETACH DELETE n"""
                .formatted(safe(label), datasetKey, idKey);
    }

    public String deleteRelationshipsOfType(String type) {
        return """
            MATCH ()-[r:%s]->() \
            WHERE r.%s = $dataset \
            DELETE r"""
                .formatted(safe(type), datasetKey);
    }

    // ==================== Reads ====================

    public String findExistingNodeIds(String label) {
        return """
            MATCH (n:%s {%s: $dataset}) \
            WHERE n.%s IN $ids \
            RETURN DISTINCT n.%s AS id"""
                .formatted(safe(label), datasetKey, idKey, idKey);
    }

    /**
     * @param type relationship type, null to count every type
     */
    public String countRelationships(String type) {
        String pattern = type == null ? "r" : "r:" + safe(type);
        return "MATCH ()-[%s]->() WHERE r.%s = $dataset RETURN count(r) AS count"
                .formatted(pattern, datasetKey);
    }

    /**
     * The label may come from the database, so it is quoted, not sanitized.
     */
    public String countNodes(String existingLabel) {
        return "MATCH (n:%s {%s: $dataset}) RETURN count(n) AS count"
                .formatted(quote(existingLabel), datasetKey);
    }

    public String labelsForDataset() {
        return """
            MATCH (n) \
            WHERE n.%s = $dataset \
            UNWIND labels(n) AS label \
            RETURN DISTINCT label \
            ORDER BY label"""
                .formatted(datasetKey);
    }

    public String relationshipTypesForDataset() {
        return """
            MATCH ()-[r]->() \
            WHERE r.%s = $dataset \
            RETURN DISTINCT type(r) AS type \
            ORDER BY type"""
                .formatted(datasetKey);
    }

    public String datasetPropertyKeys(String existingLabel) {
        return """
            MATCH (n:%s {%s: $dataset}) \
            UNWIND keys(n) AS key \
            RETURN DISTINCT key \
            ORDER BY key"""
                .formatted(quote(existingLabel), datasetKey);
    }

    // ==================== Schema ====================

    public String allLabels() {
        return "CALL db.labels() YIELD label RETURN label ORDER BY label";
    }

    public String allRelationshipTypes() {
        return "CALL db.relationshipTypes() YIELD relationshipType RETURN relationshipType ORDER BY relationshipType";
    }

    /**
     * Property keys of a sample of nodes; the label comes from the database and is quoted, not sanitized.
     */
    public String propertyKeys(String existingLabel, int sampleSize) {
        return """
            MATCH (n:%s) \
            WITH n LIMIT %d \
            UNWIND keys(n) AS key \
            RETURN DISTINCT key \
            ORDER BY key"""
                .formatted(quote(existingLabel), sampleSize);
    }
}
