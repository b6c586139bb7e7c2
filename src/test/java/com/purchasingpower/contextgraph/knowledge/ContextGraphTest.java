package com.purchasingpower.contextgraph.knowledge;

import com.purchasingpower.contextgraph.configuration.GraphProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.model.graph.ContextEdge;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.model.graph.DependencyEntry;
import com.purchasingpower.contextgraph.model.graph.Neighbor;
import com.purchasingpower.contextgraph.service.graph.impl.GraphTraversalServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Context Graph Store Tests")
class ContextGraphTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ContextGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ContextGraph(1.0, Clock.fixed(NOW, ZoneOffset.UTC));
        graph.addNode("A", Map.of("name", "a"));
        graph.addNode("B", Map.of("name", "b"));
        graph.addNode("C", Map.of("name", "c"));
    }

    @Test
    @DisplayName("Should default the edge weight when none is given")
    void addEdge_defaultWeight() {
        ContextEdge edge = graph.addEdge("A", "B", "parent");

        assertThat(edge.getWeight()).isEqualTo(1.0);
        assertThat(edge.getCreatedAt()).isEqualTo(NOW);
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject an edge whose endpoint is missing")
    void addEdge_missingEndpoint() {
        assertThatThrownBy(() -> graph.addEdge("A", "Z", "parent"))
                .isInstanceOf(NodeNotFoundException.class)
                .hasMessageContaining("Z");

        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    @DisplayName("Should reject weights outside (0,1]")
    void addEdge_weightOutOfRange() {
        assertThatThrownBy(() -> graph.addEdge("A", "B", "parent", 1.5, null))
                .isInstanceOf(ContextValidationException.class);
        assertThatThrownBy(() -> graph.addEdge("A", "B", "parent", 0.0, null))
                .isInstanceOf(ContextValidationException.class);
    }

    @Test
    @DisplayName("Should replace an edge with the same endpoints and type")
    void addEdge_replacesDuplicate() {
        graph.addEdge("A", "B", "depends-on", 0.5, null);
        graph.addEdge("A", "B", "depends-on", 0.9, null);

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.outgoingEdges("A")).singleElement()
                .extracting(ContextEdge::getWeight).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Should keep edges when a node payload is replaced")
    void addNode_updateKeepsEdges() {
        graph.addEdge("A", "B", "parent");

        ContextNode updated = graph.addNode("A", Map.of("name", "a2"));

        assertThat(updated.getPayload()).containsEntry("name", "a2");
        assertThat(graph.nodeCount()).isEqualTo(3);
        assertThat(graph.outgoingEdges("A")).hasSize(1);
    }

    @Test
    @DisplayName("Should cascade edge removal when a node is removed")
    void removeNode_cascades() {
        graph.addEdge("A", "B", "parent");
        graph.addEdge("C", "B", "depends-on");
        graph.addEdge("B", "C", "references");

        boolean removed = graph.removeNode("B");

        assertThat(removed).isTrue();
        assertThat(graph.containsNode("B")).isFalse();
        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.outgoingEdges("A")).isEmpty();
        assertThat(graph.incomingEdges("C")).isEmpty();
        assertThat(graph.relationshipTypes()).isEmpty();
    }

    @Test
    @DisplayName("Should report false when removing an unknown node")
    void removeNode_unknown() {
        assertThat(graph.removeNode("Z")).isFalse();
    }

    @Test
    @DisplayName("Should list neighbors by direction and type")
    void getNeighbors_filters() {
        graph.addEdge("A", "B", "parent");
        graph.addEdge("C", "A", "depends-on", 0.7, null);

        List<Neighbor> both = graph.getNeighbors("A", RelationshipDirection.BOTH, null);
        List<Neighbor> incomingDeps = graph.getNeighbors("A", RelationshipDirection.INCOMING, List.of("depends-on"));
        List<Neighbor> outgoingDeps = graph.getNeighbors("A", RelationshipDirection.OUTGOING, List.of("depends-on"));

        assertThat(both).extracting(Neighbor::getContextId).containsExactly("B", "C");
        assertThat(incomingDeps).singleElement().satisfies(n -> {
            assertThat(n.getContextId()).isEqualTo("C");
            assertThat(n.getDirection()).isEqualTo(RelationshipDirection.INCOMING);
            assertThat(n.getWeight()).isEqualTo(0.7);
        });
        assertThat(outgoingDeps).isEmpty();
    }

    @Test
    @DisplayName("Should notify listeners after each mutation")
    void listeners_receiveMutations() {
        List<String> events = new ArrayList<>();
        graph.addListener(new GraphMutationListener() {
            @Override
            public void onNodeUpserted(ContextNode node) {
                events.add("node+" + node.getId());
            }

            @Override
            public void onNodeRemoved(String contextId) {
                events.add("node-" + contextId);
            }

            @Override
            public void onEdgeAdded(ContextEdge edge) {
                events.add("edge+" + edge.getFrom() + edge.getTo());
            }

            @Override
            public void onEdgeRemoved(ContextEdge edge) {
                events.add("edge-" + edge.getFrom() + edge.getTo());
            }
        });

        graph.addNode("D", Map.of());
        graph.addEdge("D", "A", "parent");
        graph.removeNode("D");

        assertThat(events).containsExactly("node+D", "edge+DA", "edge-DA", "node-D");
    }

    @Test
    @DisplayName("Should count accesses without changing the payload")
    void recordAccess_touchesNode() {
        graph.recordAccess("A");
        graph.recordAccess("A");
        graph.recordAccess("missing");

        ContextNode node = graph.getNode("A").orElseThrow();
        assertThat(node.getAccessCount()).isEqualTo(2);
        assertThat(node.getLastAccessedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should expose the payload read-only")
    void payload_isUnmodifiable() {
        ContextNode node = graph.getNode("A").orElseThrow();

        assertThatThrownBy(() -> node.getPayload().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject a blank relationship type")
    void addEdge_blankType() {
        assertThatThrownBy(() -> graph.addEdge("A", "B", " "))
                .isInstanceOf(ContextValidationException.class);
    }

    // ================================================================
    // CONCURRENCY
    // ================================================================

    @Test
    @DisplayName("Should let traversals run while another thread adds and removes nodes")
    void traversalsDuringMutation() throws Exception {
        GraphTraversalServiceImpl traversal = new GraphTraversalServiceImpl(graph, new GraphProperties());
        List<String> types = List.of("depends-on");
        int readers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(readers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        AtomicInteger reads = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int r = 0; r < readers; r++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    do {
                        traversal.findDependencies("A", 5, types, true);
                        traversal.findImpactedContexts("B", 5, types, 0.0, 0.8);
                        traversal.detectCycles(types);
                        traversal.statistics();
                        assertThat(graph.edges()).hasSizeLessThanOrEqualTo(4);
                        reads.incrementAndGet();
                    } while (writing.get());
                    return null;
                }));
            }
            Future<?> writer = executor.submit(() -> {
                start.await();
                try {
                    for (int i = 0; i < 500; i++) {
                        String id = "n" + i;
                        graph.addNode(id, Map.of("step", i));
                        graph.addEdge("A", id, "depends-on");
                        graph.addEdge(id, "B", "depends-on");
                        if (i > 0) {
                            graph.removeNode("n" + (i - 1));
                        }
                    }
                } finally {
                    writing.set(false);
                }
                return null;
            });

            start.countDown();
            writer.get(30, TimeUnit.SECONDS);
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(reads.get()).isPositive();
        assertThat(graph.nodeIds()).containsExactlyInAnyOrder("A", "B", "C", "n499");
        assertThat(graph.edgeCount()).isEqualTo(2).isEqualTo(graph.edges().size());
        assertThat(new GraphTraversalServiceImpl(graph, new GraphProperties())
                .findDependencies("A", 5, types, true))
                .extracting(DependencyEntry::getContextId)
                .containsExactly("n499", "B");
    }
}
