package com.purchasingpower.contextgraph.model.graph;

import lombok.Value;

import java.util.List;

/**
 * A closed dependency loop. {@code nodes} starts and ends with the same id.
 */
@Value
public class DependencyCycle {

    public static final String DEPENDENCY_CYCLE = "dependency-cycle";

    List<String> nodes;
    List<ContextEdge> edges;
    String type;

    public DependencyCycle(List<String> nodes, List<ContextEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        this.type = DEPENDENCY_CYCLE;
    }
}
