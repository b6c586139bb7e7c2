package com.purchasingpower.contextgraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Directed, weighted, typed relationship between two context nodes.
 * Endpoints are node ids; the graph guarantees both exist while the edge does.
 */
@Value
@Builder
public class ContextEdge {

    String from;
    String to;
    String relationshipType;
    double weight;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    Instant createdAt;

    public boolean connects(String fromId, String toId, String type) {
        return from.equals(fromId) && to.equals(toId) && relationshipType.equals(type);
    }
}
