package com.purchasingpower.contextgraph.model.graph;

import lombok.Value;

import java.util.List;

/**
 * Result of a shortest path search: ordered edges, visited node ids and the
 * accumulated cost.
 */
@Value
public class GraphPath {
    List<ContextEdge> edges;
    List<String> nodes;
    double totalCost;

    public int length() {
        return edges.size();
    }
}
