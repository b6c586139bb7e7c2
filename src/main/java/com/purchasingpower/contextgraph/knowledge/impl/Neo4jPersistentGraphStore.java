package com.purchasingpower.contextgraph.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.PersistenceProperties;
import com.purchasingpower.contextgraph.exception.PersistenceException;
import com.purchasingpower.contextgraph.knowledge.PersistentGraphStore;
import com.purchasingpower.contextgraph.knowledge.RelationshipDirection;
import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.Neighbor;
import com.purchasingpower.contextgraph.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Neo4j mirror of the context graph.
 *
 * <p>Nodes are {@code (:Context {id})} with the payload stored as a JSON string;
 * edges are {@code [:RELATES_TO {type, weight}]}, one per (from, to, type).
 * Only created when {@code context-graph.persistence.enabled=true}.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "context-graph.persistence", name = "enabled", havingValue = "true")
public class Neo4jPersistentGraphStore implements PersistentGraphStore {

    private final PersistenceProperties properties;
    private final ObjectMapper objectMapper;
    private Driver driver;

    public Neo4jPersistentGraphStore(PersistenceProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    Neo4jPersistentGraphStore(PersistenceProperties properties, ObjectMapper objectMapper, Driver driver) {
        this(properties, objectMapper);
        this.driver = driver;
    }

    // ================================================================
    // LIFECYCLE MANAGEMENT
    // ================================================================

    @PostConstruct
    public void init() {
        log.info("Connecting to Neo4j at: {} (database {})", properties.getUri(), properties.getDatabase());
        driver = GraphDatabase.driver(properties.getUri(),
                AuthTokens.basic(properties.getUsername(), properties.getPassword()),
                Config.builder()
                        .withMaxConnectionPoolSize(properties.getMaxConnectionPoolSize())
                        .withConnectionAcquisitionTimeout(
                                properties.getConnectionAcquisitionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .build());
        createSchema();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j connection closed");
        }
    }

    private void createSchema() {
        try (Session session = session()) {
            session.run("CREATE CONSTRAINT context_id_unique IF NOT EXISTS FOR (c:Context) REQUIRE c.id IS UNIQUE");
            session.run("CREATE INDEX context_level IF NOT EXISTS FOR (c:Context) ON (c.level)");
            session.run("CREATE INDEX context_type IF NOT EXISTS FOR (c:Context) ON (c.type)");
            session.run("CREATE INDEX rel_type IF NOT EXISTS FOR ()-[r:RELATES_TO]-() ON (r.type)");
            log.info("Neo4j schema created/verified");
        } catch (Neo4jException e) {
            log.warn("Failed to create schema (may already exist): {}", e.getMessage());
        }
    }

    // ================================================================
    // WRITES
    // ================================================================

    @Override
    public void upsertNode(ContextNode node) {
        CallContext call = ExternalCallLogger.startQuietCall(ServiceType.NEO4J, "UpsertNode", log);
        call.logRequest(node.getId());

        String cypher = """
                MERGE (c:Context {id: $id})
                SET c.payload = $payload,
                    c.level = $level,
                    c.type = $type,
                    c.createdAt = $createdAt,
                    c.lastAccessedAt = $lastAccessedAt,
                    c.accessCount = $accessCount
                """;
        Map<String, Object> params = params(
                "id", node.getId(),
                "payload", toJson(node.getPayload()),
                "level", stringOrNull(node.getPayload().get("level")),
                "type", stringOrNull(node.getPayload().get("type")),
                "createdAt", String.valueOf(node.getCreatedAt()),
                "lastAccessedAt", String.valueOf(node.getLastAccessedAt()),
                "accessCount", node.getAccessCount());
        write(call, cypher, params);
    }

    @Override
    public void upsertEdge(ContextEdge edge) {
        CallContext call = ExternalCallLogger.startQuietCall(ServiceType.NEO4J, "UpsertEdge", log);
        call.logRequest(edge.getFrom() + " -[" + edge.getRelationshipType() + "]-> " + edge.getTo());

        String cypher = """
                MATCH (a:Context {id: $from}), (b:Context {id: $to})
                MERGE (a)-[r:RELATES_TO {type: $type}]->(b)
                SET r.weight = $weight,
                    r.metadata = $metadata,
                    r.createdAt = $createdAt
                """;
        write(call, cypher, params(
                "from", edge.getFrom(),
                "to", edge.getTo(),
                "type", edge.getRelationshipType(),
                "weight", edge.getWeight(),
                "metadata", toJson(edge.getMetadata()),
                "createdAt", String.valueOf(edge.getCreatedAt())));
    }

    @Override
    public void deleteNode(String contextId) {
        CallContext call = ExternalCallLogger.startQuietCall(ServiceType.NEO4J, "DeleteNode", log);
        call.logRequest(contextId);
        write(call, "MATCH (c:Context {id: $id}) DETACH DELETE c", params("id", contextId));
    }

    @Override
    public void deleteEdge(ContextEdge edge) {
        CallContext call = ExternalCallLogger.startQuietCall(ServiceType.NEO4J, "DeleteEdge", log);
        call.logRequest(edge.getFrom() + " -[" + edge.getRelationshipType() + "]-> " + edge.getTo());
        write(call, """
                MATCH (:Context {id: $from})-[r:RELATES_TO {type: $type}]->(:Context {id: $to})
                DELETE r
                """, params("from", edge.getFrom(), "to", edge.getTo(), "type", edge.getRelationshipType()));
    }

    @Override
    public void clearAll() {
        if (properties.isProduction()) {
            log.error("Refusing to clear Neo4j in environment '{}'", properties.getEnvironment());
            throw new IllegalStateException("Cannot clear the graph database in production");
        }
        CallContext call = ExternalCallLogger.startCall(ServiceType.NEO4J, "ClearAll", log);
        call.logRequest("Deleting every node and relationship");
        try (Session session = session()) {
            session.run("MATCH (n) DETACH DELETE n");
            call.logResponse("Database cleared");
        } catch (Neo4jException e) {
            call.logError("Failed to clear database", e);
            throw new PersistenceException("Failed to clear Neo4j database", e);
        }
    }

    // ================================================================
    // READS
    // ================================================================

    @Override
    public List<Neighbor> fetchNeighbors(String contextId) {
        String cypher = """
                MATCH (:Context {id: $id})-[r:RELATES_TO]->(o:Context)
                RETURN o.id AS id, r.type AS type, r.weight AS weight, 'OUTGOING' AS direction
                UNION ALL
                MATCH (:Context {id: $id})<-[r:RELATES_TO]-(o:Context)
                RETURN o.id AS id, r.type AS type, r.weight AS weight, 'INCOMING' AS direction
                """;
        CallContext call = ExternalCallLogger.startQuietCall(ServiceType.NEO4J, "FetchNeighbors", log);
        call.logRequest(contextId);
        try (Session session = session()) {
            List<Neighbor> neighbors = session.executeRead(tx -> tx.run(cypher, params("id", contextId)).list(
                    r -> new Neighbor(
                            r.get("id").asString(),
                            r.get("type").asString(),
                            RelationshipDirection.valueOf(r.get("direction").asString()),
                            r.get("weight").asDouble(1.0))), timeout());
            call.logResponse(neighbors.size() + " neighbors");
            return neighbors;
        } catch (Neo4jException e) {
            call.logError("Failed to fetch neighbors", e);
            throw new PersistenceException("Failed to fetch neighbors of " + contextId, e);
        }
    }

    @Override
    public List<Map<String, Object>> runQuery(String query, Map<String, Object> parameters) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.NEO4J, "RunQuery", log);
        call.logRequest(ExternalCallLogger.truncate(query, 200), "params", ExternalCallLogger.formatMap(parameters));
        try (Session session = session()) {
            List<Map<String, Object>> rows = session.run(query, parameters == null ? Map.of() : parameters)
                    .list(Record::asMap);
            call.logResponse(rows.size() + " rows");
            return rows;
        } catch (Neo4jException e) {
            call.logError("Query failed", e);
            throw new PersistenceException("Neo4j query failed", e);
        }
    }

    @Override
    public Map<String, Object> stats() {
        List<Map<String, Object>> rows = runQuery("""
                MATCH (c:Context)
                WITH count(c) AS contextNodes
                OPTIONAL MATCH (:Context)-[r:RELATES_TO]->(:Context)
                RETURN contextNodes, count(r) AS relationships
                """, Map.of());
        return rows.isEmpty() ? Map.of() : rows.get(0);
    }

    @Override
    public boolean isAvailable() {
        if (driver == null) {
            return false;
        }
        try {
            driver.verifyConnectivity();
            return true;
        } catch (Neo4jException e) {
            log.warn("Neo4j not reachable: {}", e.getMessage());
            return false;
        }
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private void write(CallContext call, String cypher, Map<String, Object> params) {
        try (Session session = session()) {
            session.executeWrite(tx -> tx.run(cypher, params).consume(), timeout());
            call.logResponse("ok");
        } catch (Neo4jException e) {
            call.logError("Write failed", e);
            throw new PersistenceException("Neo4j write failed", e);
        }
    }

    private Session session() {
        if (driver == null) {
            throw new IllegalStateException("Neo4j driver is not initialized");
        }
        return driver.session(SessionConfig.forDatabase(properties.getDatabase()));
    }

    private TransactionConfig timeout() {
        return TransactionConfig.builder().withTimeout(properties.getCallTimeout()).build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize value for Neo4j", e);
        }
    }

    private static String stringOrNull(Object value) {
        return value instanceof String text ? text : null;
    }

    /**
     * Params map that tolerates null values, which Neo4j treats as property removal.
     */
    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
