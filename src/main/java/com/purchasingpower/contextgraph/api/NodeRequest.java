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
public class NodeRequest {

    @NotBlank
    private String id;

    private Map<String, Object> payload;

    /**
     * Derive edges from references found in the payload.
     */
    private boolean extractRelationships;
}
