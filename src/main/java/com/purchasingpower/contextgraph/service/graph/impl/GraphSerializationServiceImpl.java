package com.purchasingpower.contextgraph.service.graph.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.GraphSnapshot;
import com.purchasingpower.contextgraph.model.graph.GraphStatistics;
import com.purchasingpower.contextgraph.service.graph.GraphSerializationService;
import com.purchasingpower.contextgraph.service.graph.GraphTraversalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphSerializationServiceImpl implements GraphSerializationService {

    private final ContextGraph graph;
    private final GraphTraversalService traversalService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public GraphSnapshot export() {
        return graph.withReadLock(() -> {
            List<GraphSnapshot.NodeRecord> nodes = graph.nodes().stream()
                    .map(this::toRecord)
                    .toList();
            List<GraphSnapshot.EdgeRecord> edges = graph.edges().stream()
                    .map(this::toRecord)
                    .toList();
            return GraphSnapshot.builder()
                    .nodes(nodes)
                    .edges(edges)
                    .stats(traversalService.statistics())
                    .build();
        });
    }

    @Override
    public String exportJson() {
        try {
            return objectMapper.writeValueAsString(export());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize context graph", e);
        }
    }

    @Override
    public GraphStatistics importSnapshot(GraphSnapshot snapshot) {
        if (snapshot == null) {
            throw new ContextValidationException("snapshot", "Snapshot is required");
        }
        validate(snapshot);
        graph.clear();

        Instant now = clock.instant();
        for (GraphSnapshot.NodeRecord record : orEmpty(snapshot.getNodes())) {
            GraphSnapshot.NodeMetadata metadata = record.getMetadata();
            if (metadata == null) {
                graph.addNode(record.getId(), record.getPayload());
                continue;
            }
            Instant createdAt = metadata.getCreatedAt() == null ? now : metadata.getCreatedAt();
            graph.restoreNode(new ContextNode(
                    record.getId(),
                    record.getPayload(),
                    createdAt,
                    metadata.getLastAccessedAt() == null ? createdAt : metadata.getLastAccessedAt(),
                    metadata.getAccessCount()));
        }

        for (GraphSnapshot.EdgeRecord record : orEmpty(snapshot.getEdges())) {
            graph.restoreEdge(ContextEdge.builder()
                    .from(record.getFrom())
                    .to(record.getTo())
                    .relationshipType(record.getType())
                    .weight(record.getWeight() == 0 ? graph.getDefaultEdgeWeight() : record.getWeight())
                    .metadata(record.getMetadata() == null ? Map.of() : record.getMetadata())
                    .createdAt(record.getCreatedAt() == null ? now : record.getCreatedAt())
                    .build());
        }

        log.info("Imported context graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return traversalService.statistics();
    }

    @Override
    public GraphStatistics importJson(String json) {
        try {
            return importSnapshot(objectMapper.readValue(json, GraphSnapshot.class));
        } catch (JsonProcessingException e) {
            throw new ContextValidationException("snapshot", "Malformed graph snapshot: " + e.getOriginalMessage());
        }
    }

    /**
     * Checks the whole snapshot up front so that a rejected import leaves the current graph untouched.
     */
    private static void validate(GraphSnapshot snapshot) {
        Set<String> nodeIds = new HashSet<>();
        for (GraphSnapshot.NodeRecord record : orEmpty(snapshot.getNodes())) {
            if (record == null || record.getId() == null || record.getId().isBlank()) {
                throw new ContextValidationException("nodes", "Snapshot contains a node without an id");
            }
            nodeIds.add(record.getId());
        }
        for (GraphSnapshot.EdgeRecord record : orEmpty(snapshot.getEdges())) {
            if (record == null) {
                throw new ContextValidationException("edges", "Snapshot contains an empty edge");
            }
            if (!nodeIds.contains(record.getFrom())) {
                throw new NodeNotFoundException(record.getFrom(), "Source");
            }
            if (!nodeIds.contains(record.getTo())) {
                throw new NodeNotFoundException(record.getTo(), "Target");
            }
            if (record.getType() == null || record.getType().isBlank()) {
                throw new ContextValidationException("relationshipType",
                        "Edge " + record.getFrom() + " -> " + record.getTo() + " has no relationship type");
            }
            double weight = record.getWeight();
            if (weight != 0 && !(weight > 0 && weight <= 1.0)) {
                throw new ContextValidationException("weight", "Edge weight must be in (0,1]: " + weight);
            }
        }
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private GraphSnapshot.NodeRecord toRecord(ContextNode node) {
        return GraphSnapshot.NodeRecord.builder()
                .id(node.getId())
                .payload(node.getPayload())
                .metadata(GraphSnapshot.NodeMetadata.builder()
                        .createdAt(node.getCreatedAt())
                        .lastAccessedAt(node.getLastAccessedAt())
                        .accessCount(node.getAccessCount())
                        .build())
                .build();
    }

    private GraphSnapshot.EdgeRecord toRecord(ContextEdge edge) {
        return GraphSnapshot.EdgeRecord.builder()
                .from(edge.getFrom())
                .to(edge.getTo())
                .type(edge.getRelationshipType())
                .weight(edge.getWeight())
                .metadata(edge.getMetadata())
                .createdAt(edge.getCreatedAt())
                .build();
    }
}
