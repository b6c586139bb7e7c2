package com.purchasingpower.contextgraph.model.context;

import com.purchasingpower.contextgraph.model.graph.ContextNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Input of every compression strategy: the payload of one context plus the
 * facts needed to choose how hard to compress it.
 */
@Value
@Builder(toBuilder = true)
public class ContextRecord {

    String id;

    /**
     * {@code null} for records without a level; those use generic key preservation.
     */
    ContextLevel level;

    Map<String, Object> payload;

    Instant createdAt;

    public static ContextRecord fromNode(ContextNode node, ContextLevel level) {
        return ContextRecord.builder()
                .id(node.getId())
                .level(level)
                .payload(node.getPayload())
                .createdAt(node.getCreatedAt())
                .build();
    }
}
