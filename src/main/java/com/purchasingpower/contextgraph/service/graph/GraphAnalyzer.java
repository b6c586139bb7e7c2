package com.purchasingpower.contextgraph.service.graph;

import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.model.graph.GraphPosition;

/**
 * Reduces a node's neighborhood, dependencies and impact set to the two
 * scalars consumed by graph-aware compression.
 */
public interface GraphAnalyzer {

    /**
     * @throws NodeNotFoundException when the node is not in the graph
     */
    GraphPosition analyze(String contextId);

    /**
     * {@code 0.4*min(rel/10,1) + 0.4*min(impacted/5,1) + 0.2*max(1-deps/10, 0.1)}
     */
    static double centrality(int relationshipCount, int dependencyCount, int impactedCount) {
        double relScore = Math.min(relationshipCount / 10.0, 1.0);
        double dependentScore = Math.min(impactedCount / 5.0, 1.0);
        double specificityScore = Math.max(1.0 - dependencyCount / 10.0, 0.1);
        return relScore * 0.4 + dependentScore * 0.4 + specificityScore * 0.2;
    }
}
