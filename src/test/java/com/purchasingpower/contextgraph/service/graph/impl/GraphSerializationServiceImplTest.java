package com.purchasingpower.contextgraph.service.graph.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.GraphProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.GraphSnapshot;
import com.purchasingpower.contextgraph.model.graph.GraphStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Graph Export / Import Tests")
class GraphSerializationServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private ContextGraph graph;
    private GraphSerializationServiceImpl serialization;

    @BeforeEach
    void setUp() {
        graph = new ContextGraph();
        serialization = new GraphSerializationServiceImpl(graph,
                new GraphTraversalServiceImpl(graph, new GraphProperties()), objectMapper, CLOCK);

        graph.addNode("task-1", Map.of("status", "running", "progress", 40));
        graph.addNode("agent-1", Map.of("agentType", "builder"));
        graph.addEdge("task-1", "agent-1", "executes", 0.8, Map.of("since", "start"));
        graph.recordAccess("task-1");
    }

    @Test
    @DisplayName("Should restore nodes, edges and access metadata from exported JSON")
    void exportThenImport() {
        String json = serialization.exportJson();
        ContextNode before = graph.getNode("task-1").orElseThrow();

        ContextGraph restoredGraph = new ContextGraph();
        GraphSerializationServiceImpl target = new GraphSerializationServiceImpl(restoredGraph,
                new GraphTraversalServiceImpl(restoredGraph, new GraphProperties()), objectMapper, CLOCK);
        GraphStatistics stats = target.importJson(json);

        assertThat(stats.getNodeCount()).isEqualTo(2);
        assertThat(stats.getEdgeCount()).isEqualTo(1);

        ContextNode restored = restoredGraph.getNode("task-1").orElseThrow();
        assertThat(restored.getPayload()).containsEntry("status", "running").containsEntry("progress", 40);
        assertThat(restored.getCreatedAt()).isEqualTo(before.getCreatedAt());
        assertThat(restored.getAccessCount()).isEqualTo(1);

        ContextEdge edge = restoredGraph.outgoingEdges("task-1").get(0);
        assertThat(edge.getTo()).isEqualTo("agent-1");
        assertThat(edge.getWeight()).isEqualTo(0.8);
        assertThat(edge.getMetadata()).containsEntry("since", "start");
    }

    @Test
    @DisplayName("Should replace existing content on import")
    void importReplaces() {
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .nodes(List.of(GraphSnapshot.NodeRecord.builder().id("only").payload(Map.of()).build()))
                .build();

        serialization.importSnapshot(snapshot);

        assertThat(graph.nodeIds()).containsExactly("only");
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    @DisplayName("Should use the default weight for edges exported without one")
    void defaultWeightOnImport() {
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .nodes(List.of(
                        GraphSnapshot.NodeRecord.builder().id("a").build(),
                        GraphSnapshot.NodeRecord.builder().id("b").build()))
                .edges(List.of(GraphSnapshot.EdgeRecord.builder().from("a").to("b").type("parent").build()))
                .build();

        serialization.importSnapshot(snapshot);

        assertThat(graph.outgoingEdges("a")).singleElement()
                .extracting(ContextEdge::getWeight).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should fail on an edge to an unknown node")
    void danglingEdge() {
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .nodes(List.of(GraphSnapshot.NodeRecord.builder().id("a").build()))
                .edges(List.of(GraphSnapshot.EdgeRecord.builder().from("a").to("ghost").type("parent").weight(1.0).build()))
                .build();

        assertThatThrownBy(() -> serialization.importSnapshot(snapshot))
                .isInstanceOf(NodeNotFoundException.class);
    }

    @Test
    @DisplayName("Should leave the current graph intact when the snapshot is rejected")
    void rejectedImportKeepsGraph() {
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .nodes(List.of(
                        GraphSnapshot.NodeRecord.builder().id("keep-1").build(),
                        GraphSnapshot.NodeRecord.builder().id("keep-2").build()))
                .edges(List.of(GraphSnapshot.EdgeRecord.builder().from("keep-1").to("ghost").type("parent").build()))
                .build();

        assertThatThrownBy(() -> serialization.importSnapshot(snapshot))
                .isInstanceOfSatisfying(NodeNotFoundException.class, e -> assertThat(e.getNodeId()).isEqualTo("ghost"));

        assertThat(graph.nodeIds()).containsExactlyInAnyOrder("task-1", "agent-1");
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.getNode("task-1").orElseThrow().getAccessCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject out-of-range weights and blank ids before touching the graph")
    void invalidRecords() {
        GraphSnapshot badWeight = GraphSnapshot.builder()
                .nodes(List.of(
                        GraphSnapshot.NodeRecord.builder().id("a").build(),
                        GraphSnapshot.NodeRecord.builder().id("b").build()))
                .edges(List.of(GraphSnapshot.EdgeRecord.builder().from("a").to("b").type("parent").weight(1.5).build()))
                .build();
        GraphSnapshot blankId = GraphSnapshot.builder()
                .nodes(List.of(GraphSnapshot.NodeRecord.builder().id(" ").build()))
                .build();

        assertThatThrownBy(() -> serialization.importSnapshot(badWeight))
                .isInstanceOfSatisfying(ContextValidationException.class, e -> assertThat(e.getField()).isEqualTo("weight"));
        assertThatThrownBy(() -> serialization.importSnapshot(blankId))
                .isInstanceOf(ContextValidationException.class);
        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stamp imported edges without a creation time from the clock")
    void importTimestamps() {
        GraphSnapshot snapshot = GraphSnapshot.builder()
                .nodes(List.of(
                        GraphSnapshot.NodeRecord.builder().id("a").build(),
                        GraphSnapshot.NodeRecord.builder().id("b").build()))
                .edges(List.of(GraphSnapshot.EdgeRecord.builder().from("a").to("b").type("parent").weight(0.5).build()))
                .build();

        serialization.importSnapshot(snapshot);

        assertThat(graph.outgoingEdges("a")).singleElement()
                .extracting(ContextEdge::getCreatedAt).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void malformedJson() {
        assertThatThrownBy(() -> serialization.importJson("{not json"))
                .isInstanceOf(ContextValidationException.class);
    }
}
