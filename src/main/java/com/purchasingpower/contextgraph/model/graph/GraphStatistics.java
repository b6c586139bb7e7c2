package com.purchasingpower.contextgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {
    private int nodeCount;
    private int edgeCount;
    private List<String> relationshipTypes;
    private double averageDegree;
    private double density;
    private int components;
}
