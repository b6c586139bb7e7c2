package com.purchasingpower.contextgraph.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializable form of a whole context graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphSnapshot {

    @Builder.Default
    private List<NodeRecord> nodes = new ArrayList<>();

    @Builder.Default
    private List<EdgeRecord> edges = new ArrayList<>();

    private GraphStatistics stats;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeRecord {
        private String id;
        private Map<String, Object> payload;
        private NodeMetadata metadata;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeMetadata {
        private Instant createdAt;
        private Instant lastAccessedAt;
        private long accessCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EdgeRecord {
        private String from;
        private String to;
        private String type;
        private double weight;
        private Map<String, Object> metadata;
        private Instant createdAt;
    }
}
