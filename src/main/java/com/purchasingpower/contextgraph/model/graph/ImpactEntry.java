package com.purchasingpower.contextgraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A node affected by a change to the origin, with its decayed impact score.
 */
@Value
@Builder
public class ImpactEntry {
    String contextId;
    double impact;
    int distance;
    String relationship;
    List<ContextEdge> path;
}
