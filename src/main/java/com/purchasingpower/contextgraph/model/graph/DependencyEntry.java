package com.purchasingpower.contextgraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A node reached while following outgoing dependency edges.
 */
@Value
@Builder
public class DependencyEntry {
    String contextId;
    String relationship;
    int distance;
    double weight;
    List<ContextEdge> path;
    Map<String, Object> metadata;
}
