package com.purchasingpower.contextgraph.service.graph.impl;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.knowledge.RelationshipDirection;
import com.purchasingpower.contextgraph.model.graph.DependencyEntry;
import com.purchasingpower.contextgraph.model.graph.GraphPosition;
import com.purchasingpower.contextgraph.model.graph.ImpactEntry;
import com.purchasingpower.contextgraph.model.graph.Neighbor;
import com.purchasingpower.contextgraph.service.graph.GraphAnalyzer;
import com.purchasingpower.contextgraph.service.graph.GraphTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphAnalyzerImpl implements GraphAnalyzer {

    private static final double BASE_IMPORTANCE = 0.5;
    private static final double UNKNOWN_RELATIONSHIP_IMPORTANCE = 0.5;

    private final ContextGraph graph;
    private final GraphTraversalService traversalService;
    private final CompressionProperties compressionProperties;

    @Override
    public GraphPosition analyze(String contextId) {
        if (!graph.containsNode(contextId)) {
            throw new NodeNotFoundException(contextId);
        }

        List<Neighbor> neighbors = graph.getNeighbors(contextId, RelationshipDirection.BOTH, null);
        List<DependencyEntry> dependencies = traversalService.findDependencies(contextId);
        List<ImpactEntry> impacted = traversalService.findImpactedContexts(contextId);

        double centrality = GraphAnalyzer.centrality(neighbors.size(), dependencies.size(), impacted.size());
        double importance = importance(neighbors, dependencies.size(), impacted.size());

        log.debug("Graph position of {}: relationships={}, dependencies={}, impacted={}, centrality={}, importance={}",
                contextId, neighbors.size(), dependencies.size(), impacted.size(), centrality, importance);

        return GraphPosition.builder()
                .contextId(contextId)
                .relationshipCount(neighbors.size())
                .dependencyCount(dependencies.size())
                .impactedCount(impacted.size())
                .centralityScore(centrality)
                .importance(importance)
                .build();
    }

    private double importance(List<Neighbor> neighbors, int dependencyCount, int impactedCount) {
        double importance = BASE_IMPORTANCE;
        importance += Math.min(impactedCount * 0.1, 0.3);
        for (Neighbor neighbor : neighbors) {
            importance += compressionProperties.getRelationshipImportance()
                    .getOrDefault(neighbor.getRelationship(), UNKNOWN_RELATIONSHIP_IMPORTANCE) * 0.05;
        }
        importance -= Math.min(dependencyCount * 0.02, 0.1);
        return Math.min(Math.max(importance, 0.1), 1.0);
    }
}
