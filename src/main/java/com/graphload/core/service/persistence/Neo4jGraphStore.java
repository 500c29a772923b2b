package com.graphload.core.service.persistence;

import com.graphload.core.service.config.GraphLoadConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Neo4j implementation of GraphStore.
 *
 * Each call runs in its own managed transaction bounded by
 * {@code graphload.neo4j.query-timeout}; driver exceptions propagate to the caller.
 */
@Slf4j
@Component
public class Neo4jGraphStore implements GraphStore {

    private static final int SCHEMA_SAMPLE_SIZE = 100;

    private final Driver driver;
    private final CypherBuilder cypher;
    private final GraphLoadConfig.Neo4jConfig neo4jConfig;
    private final TransactionConfig transactionConfig;

    public Neo4jGraphStore(Driver driver, CypherBuilder cypher, GraphLoadConfig config) {
        this.driver = driver;
        this.cypher = cypher;
        this.neo4jConfig = config.getNeo4j();
        this.transactionConfig = TransactionConfig.builder()
                .withTimeout(neo4jConfig.getQueryTimeout())
                .build();
    }

    @PostConstruct
    void init() {
        try {
            driver.verifyConnectivity();
            log.info("Connected to Neo4j at {}", neo4jConfig.getUri());
        } catch (Exception e) {
            log.warn("Failed to connect to Neo4j at {}: {}", neo4jConfig.getUri(), e.getMessage());
        }
    }

    // ==================== Writes ====================

    @Override
    public UpsertResult upsertNodes(String label, List<Map<String, Object>> nodes) {
        if (nodes.isEmpty()) {
            return UpsertResult.empty();
        }
        String query = cypher.upsertNodes(label);
        Map<String, Object> params = Map.of(CypherBuilder.ROWS, nodes);

        return write(tx -> {
            var result = tx.run(query, params);
            long written = result.single().get("written").asLong();
            var counters = result.consume().counters();
            log.debug("Upserted {} :{} nodes ({} created)", written, label, counters.nodesCreated());
            return new UpsertResult(nodes.size(), written, counters.nodesCreated());
        });
    }

    @Override
    public UpsertResult upsertRelationships(String sourceLabel, String targetLabel, String type,
                                            List<RelationshipRow> rows, long datasetId) {
        if (rows.isEmpty()) {
            return UpsertResult.empty();
        }
        String query = cypher.upsertRelationships(sourceLabel, targetLabel, type);

        var rowParams = new ArrayList<Map<String, Object>>(rows.size());
        for (var row : rows) {
            var param = new HashMap<String, Object>();
            param.put("source", row.sourceId());
            param.put("target", row.targetId());
            param.put("props", row.properties());
            rowParams.add(param);
        }
        Map<String, Object> params = Map.of(CypherBuilder.ROWS, rowParams, CypherBuilder.DATASET, datasetId);

        return write(tx -> {
            var result = tx.run(query, params);
            long written = result.single().get("written").asLong();
            var counters = result.consume().counters();
            log.debug("Upserted {} (:{})-[:{}]->(:{}) relationships ({} created)",
                    written, sourceLabel, type, targetLabel, counters.relationshipsCreated());
            return new UpsertResult(rows.size(), written, counters.relationshipsCreated());
        });
    }

    @Override
    public long deleteNodesNotIn(String label, Collection<?> ids, long datasetId) {
        String query = cypher.deleteNodesNotIn(label);
        Map<String, Object> params = Map.of(CypherBuilder.IDS, List.copyOf(ids), CypherBuilder.DATASET, datasetId);

        long deleted = write(tx -> (long) tx.run(query, params).consume().counters().nodesDeleted());
        log.info("Deleted {} :{} nodes missing from the upload in dataset {}", deleted, label, datasetId);
        return deleted;
    }

    @Override
    public long deleteRelationshipsOfType(String type, long datasetId) {
        String query = cypher.deleteRelationshipsOfType(type);
        Map<String, Object> params = Map.of(CypherBuilder.DATASET, datasetId);

        long deleted = write(tx -> (long) tx.run(query, params).consume().counters().relationshipsDeleted());
        log.info("Deleted {} :{} relationships in dataset {}", deleted, type, datasetId);
        return deleted;
    }

    // ==================== Reads ====================

    @Override
    public Set<Object> findExistingNodeIds(String label, Collection<?> ids, long datasetId) {
        if (ids.isEmpty()) {
            return Set.of();
        }
        String query = cypher.findExistingNodeIds(label);
        Map<String, Object> params = Map.of(CypherBuilder.IDS, List.copyOf(ids), CypherBuilder.DATASET, datasetId);

        return read(tx -> {
            var found = new LinkedHashSet<Object>();
            tx.run(query, params).forEachRemaining(record -> found.add(record.get("id").asObject()));
            return found;
        });
    }

    @Override
    public long countRelationships(String type, long datasetId) {
        String query = cypher.countRelationships(type);
        return read(tx -> tx.run(query, Map.of(CypherBuilder.DATASET, datasetId)).single().get("count").asLong());
    }

    @Override
    public long countNodes(String label, long datasetId) {
        String query = cypher.countNodes(label);
        return read(tx -> tx.run(query, Map.of(CypherBuilder.DATASET, datasetId)).single().get("count").asLong());
    }

    @Override
    public List<String> labelsForDataset(long datasetId) {
        String query = cypher.labelsForDataset();
        return read(tx -> tx.run(query, Map.of(CypherBuilder.DATASET, datasetId))
                .list(record -> record.get("label").asString()));
    }

    @Override
    public List<String> relationshipTypesForDataset(long datasetId) {
        String query = cypher.relationshipTypesForDataset();
        return read(tx -> tx.run(query, Map.of(CypherBuilder.DATASET, datasetId))
                .list(record -> record.get("type").asString()));
    }

    @Override
    public List<String> propertyKeys(String label, long datasetId) {
        String query = cypher.datasetPropertyKeys(label);
        return read(tx -> tx.run(query, Map.of(CypherBuilder.DATASET, datasetId))
                .list(record -> record.get("key").asString()));
    }

    @Override
    public GraphSchema describeSchema() {
        return read(tx -> {
            List<String> labels = tx.run(cypher.allLabels()).list(record -> record.get("label").asString());
            List<String> types = tx.run(cypher.allRelationshipTypes())
                    .list(record -> record.get("relationshipType").asString());

            var propertyKeys = new LinkedHashMap<String, List<String>>();
            for (String label : labels) {
                List<String> keys = tx.run(cypher.propertyKeys(label, SCHEMA_SAMPLE_SIZE))
                        .list(record -> record.get("key").asString());
                propertyKeys.put(label, keys);
            }
            log.debug("Schema read: {} labels, {} relationship types", labels.size(), types.size());
            return new GraphSchema(labels, types, propertyKeys);
        });
    }

    // ==================== Sessions ====================

    private <T> T write(TransactionCallback<T> work) {
        try (var session = driver.session(sessionConfig())) {
            return session.executeWrite(work, transactionConfig);
        }
    }

    private <T> T read(TransactionCallback<T> work) {
        try (var session = driver.session(sessionConfig())) {
            return session.executeRead(work, transactionConfig);
        }
    }

    private SessionConfig sessionConfig() {
        String database = neo4jConfig.getDatabase();
        return database == null || database.isBlank()
                ? SessionConfig.defaultConfig()
                : SessionConfig.forDatabase(database);
    }
}
