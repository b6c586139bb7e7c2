package com.purchasingpower.contextgraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the graph API against the in-memory graph.
 *
 * Every test starts from the four-node fixture:
 * A->B (parent), A->C (parent), B->D (depends-on 0.9), C->D (references 0.5).
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Context Graph API Tests")
class ContextGraphControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ContextGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        graph.clear();
        for (String id : List.of("A", "B", "C", "D")) {
            addNode(id, Map.of("name", id));
        }
        addEdge("A", "B", "parent", 1.0);
        addEdge("A", "C", "parent", 1.0);
        addEdge("B", "D", "depends-on", 0.9);
        addEdge("C", "D", "references", 0.5);
    }

    @Test
    @DisplayName("Should report graph statistics")
    void stats() throws Exception {
        mockMvc.perform(get("/api/v1/graph/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodeCount").value(4))
                .andExpect(jsonPath("$.edgeCount").value(4))
                .andExpect(jsonPath("$.components").value(1));
    }

    @Test
    @DisplayName("Should list the depends-on dependencies of B")
    void dependencies() throws Exception {
        mockMvc.perform(get("/api/v1/graph/nodes/B/dependencies").param("types", "depends-on"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].contextId").value("D"))
                .andExpect(jsonPath("$[0].distance").value(1))
                .andExpect(jsonPath("$[0].weight").value(0.9));
    }

    @Test
    @DisplayName("Should report the B -> D -> B cycle")
    void cycles() throws Exception {
        addEdge("D", "B", "depends-on", 0.6);

        mockMvc.perform(get("/api/v1/graph/cycles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].nodes", contains("B", "D", "B")))
                .andExpect(jsonPath("$[0].type").value("dependency-cycle"));
    }

    @Test
    @DisplayName("Should rank impacted contexts of D")
    void impact() throws Exception {
        mockMvc.perform(get("/api/v1/graph/nodes/D/impact"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].contextId").value("B"))
                .andExpect(jsonPath("$[0].distance").value(1));
    }

    @Test
    @DisplayName("Should return the weighted shortest path, or 204 when unreachable")
    void shortestPath() throws Exception {
        mockMvc.perform(get("/api/v1/graph/path").param("from", "A").param("to", "D"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes", contains("A", "B", "D")));

        mockMvc.perform(get("/api/v1/graph/path").param("from", "D").param("to", "A"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Should return 404 for an unknown node")
    void unknownNode() throws Exception {
        mockMvc.perform(get("/api/v1/graph/nodes/missing/analysis"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.subject").value("missing"));

        mockMvc.perform(delete("/api/v1/graph/nodes/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should reject an edge to an unknown node and a blank node id")
    void invalidMutations() throws Exception {
        mockMvc.perform(post("/api/v1/graph/edges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("from", "A", "to", "Z", "type", "parent"))))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/v1/graph/edges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("from", "A", "to", "B", "type", "parent", "weight", 2.0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.subject").value("weight"));

        mockMvc.perform(post("/api/v1/graph/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("id", ""))))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should remove a node with its edges")
    void removeNode() throws Exception {
        mockMvc.perform(delete("/api/v1/graph/nodes/B"))
                .andExpect(status().isNoContent());

        assertThat(graph.containsNode("B")).isFalse();
        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should link references found in a new node's payload")
    void extractRelationships() throws Exception {
        addNode("0123456789abcdef", Map.of());

        mockMvc.perform(post("/api/v1/graph/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "id", "fedcba9876543210",
                                "payload", Map.of("parentContext", "0123456789abcdef"),
                                "extractRelationships", true))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.extractedRelationships").value(1));

        assertThat(graph.outgoingEdges("fedcba9876543210")).hasSize(1);
    }

    @Test
    @DisplayName("Should analyze the impact of a node")
    void analysis() throws Exception {
        mockMvc.perform(get("/api/v1/graph/nodes/D/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.analyzedNode").value("D"))
                .andExpect(jsonPath("$.position.contextId").value("D"))
                .andExpect(jsonPath("$.markdown", containsString("# Impact Analysis: D")));
    }

    @Test
    @DisplayName("Should restore an exported graph")
    void exportImport() throws Exception {
        String exported = mockMvc.perform(get("/api/v1/graph/export"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        graph.clear();

        mockMvc.perform(post("/api/v1/graph/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(exported))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodeCount").value(4))
                .andExpect(jsonPath("$.edgeCount").value(4));
        assertThat(graph.outgoingEdges("B")).singleElement()
                .satisfies(e -> assertThat(e.getWeight()).isEqualTo(0.9));
    }

    @Test
    @DisplayName("Should compress an inline payload with the requested strategy")
    void compressInline() throws Exception {
        CompressRequest request = CompressRequest.builder()
                .contextId("inline-1")
                .payload(Map.of("notes", "n".repeat(3000)))
                .strategy(CompressionStrategyType.TRUNCATE)
                .maxStringLength(100)
                .build();

        mockMvc.perform(post("/api/v1/graph/compress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("truncate"))
                .andExpect(jsonPath("$.truncated").value(true))
                .andExpect(jsonPath("$.contextId").value("inline-1"));
    }

    @Test
    @DisplayName("Should enforce the size limit on a graph node")
    void compressNodeWithinBudget() throws Exception {
        mockMvc.perform(post("/api/v1/graph/compress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("contextId", "A", "enforceBudget", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("none"))
                .andExpect(jsonPath("$.compressed").value(false));
    }

    @Test
    @DisplayName("Should reject an unknown context level")
    void compressUnknownLevel() throws Exception {
        mockMvc.perform(post("/api/v1/graph/compress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("contextId", "A", "level", "galaxy"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.subject").value("level"));
    }

    @Test
    @DisplayName("Should reject a non-positive token budget")
    void compressZeroBudget() throws Exception {
        mockMvc.perform(post("/api/v1/graph/compress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("contextId", "A", "strategy", "smart", "targetTokens", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.subject").value("targetTokens"));
    }

    private void addNode(String id, Map<String, Object> payload) throws Exception {
        mockMvc.perform(post("/api/v1/graph/nodes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("id", id, "payload", payload))))
                .andExpect(status().isCreated());
    }

    private void addEdge(String from, String to, String type, double weight) throws Exception {
        mockMvc.perform(post("/api/v1/graph/edges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("from", from, "to", to, "type", type, "weight", weight))))
                .andExpect(status().isCreated());
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }
}
