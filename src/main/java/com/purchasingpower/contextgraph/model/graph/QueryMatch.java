package com.purchasingpower.contextgraph.model.graph;

import lombok.Value;

import java.util.List;

/**
 * A node accepted by a filtered graph query and the edge path that reached it.
 */
@Value
public class QueryMatch {
    ContextNode node;
    List<ContextEdge> path;
    int depth;
}
