package com.purchasingpower.contextgraph.model.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Structural metrics of one node, reduced from its neighbors, dependencies
 * and impacted contexts.
 */
@Value
@Builder
public class GraphPosition {
    String contextId;
    int relationshipCount;
    int dependencyCount;
    int impactedCount;
    double centralityScore;
    double importance;
}
