package com.purchasingpower.contextgraph.model.compression;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call overrides. Any {@code null} field falls back to configuration.
 */
@Value
@Builder(toBuilder = true)
public class CompressionOptions {

    @Builder.Default
    CompressionStrategyType strategy = CompressionStrategyType.SMART;

    /** Ratio-based summarization level */
    CompressionLevel level;

    /** Token budget for smart and graph-aware compression */
    Integer targetTokens;

    /** Longest string kept intact by text truncation */
    Integer maxStringLength;

    public static CompressionOptions of(CompressionStrategyType strategy) {
        return CompressionOptions.builder().strategy(strategy).build();
    }
}
