package com.purchasingpower.contextgraph.model.graph;

import com.purchasingpower.contextgraph.knowledge.RelationshipDirection;
import lombok.Value;

/**
 * One adjacent node as seen from a given node.
 */
@Value
public class Neighbor {
    String contextId;
    String relationship;
    RelationshipDirection direction;
    double weight;
}
