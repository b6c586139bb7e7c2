package com.purchasingpower.contextgraph.model.graph;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A context record held by the graph.
 *
 * <p>Edges never reference a node object directly; they carry the node id and
 * are resolved through the owning {@code ContextGraph}. The payload map is
 * copied on construction and exposed read-only. Access bookkeeping is updated
 * by the graph under its write lock.
 */
@Getter
public class ContextNode {

    private final String id;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private Instant lastAccessedAt;
    private long accessCount;

    public ContextNode(String id, Map<String, Object> payload, Instant createdAt) {
        this(id, payload, createdAt, createdAt, 0);
    }

    public ContextNode(String id, Map<String, Object> payload, Instant createdAt,
                       Instant lastAccessedAt, long accessCount) {
        this.id = id;
        this.payload = Collections.unmodifiableMap(
                payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload));
        this.createdAt = createdAt;
        this.lastAccessedAt = lastAccessedAt;
        this.accessCount = accessCount;
    }

    /**
     * Marks the node as read at the given instant.
     */
    public void touch(Instant at) {
        this.lastAccessedAt = at;
        this.accessCount++;
    }
}
