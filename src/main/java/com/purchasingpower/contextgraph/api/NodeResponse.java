package com.purchasingpower.contextgraph.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeResponse {
    private String id;
    private Instant createdAt;
    private int extractedRelationships;
}
