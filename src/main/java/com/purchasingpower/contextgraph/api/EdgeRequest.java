package com.purchasingpower.contextgraph.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeRequest {

    @NotBlank
    private String from;

    @NotBlank
    private String to;

    /**
     * Relationship type; blank values are rejected by the graph.
     */
    private String type;

    /**
     * In (0,1]; the configured default when absent.
     */
    private Double weight;

    private Map<String, Object> metadata;
}
