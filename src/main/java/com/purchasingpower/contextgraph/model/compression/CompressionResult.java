package com.purchasingpower.contextgraph.model.compression;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Compressed payload plus what it cost. Sizes are UTF-8 bytes of compact JSON.
 */
@Value
@Builder(toBuilder = true)
public class CompressionResult {

    String contextId;

    Map<String, Object> payload;

    /** Strategy that produced {@code payload}; differs from the requested one after a fallback */
    CompressionStrategyType strategy;

    long originalSize;
    long compressedSize;

    /** {@code compressedSize / originalSize} */
    double compressionRatio;

    Instant compressedAt;

    /** {@code false} when the payload was returned as given */
    boolean compressed;

    /** Strings were cut to fit a hard size limit */
    boolean truncated;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public static double ratio(long originalSize, long compressedSize) {
        return originalSize == 0 ? 1.0 : (double) compressedSize / originalSize;
    }
}
