package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.model.compression.CompressionLevel;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Either names a graph node ({@code payload} absent) or carries the record inline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompressRequest {

    private String contextId;

    /** Context level name: global, project, agent, task */
    private String level;

    private Map<String, Object> payload;

    /** Inline records only; defaults to now */
    private Instant createdAt;

    @Builder.Default
    private CompressionStrategyType strategy = CompressionStrategyType.SMART;

    private CompressionLevel compressionLevel;
    private Integer targetTokens;
    private Integer maxStringLength;

    /**
     * Run size-limit enforcement instead of a single strategy.
     */
    private boolean enforceBudget;
}
