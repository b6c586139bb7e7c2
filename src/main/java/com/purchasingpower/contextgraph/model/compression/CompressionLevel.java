package com.purchasingpower.contextgraph.model.compression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.contextgraph.exception.ContextValidationException;

import java.util.Locale;

/**
 * Named compression levels. Their thresholds and preserve ratios are configured
 * under {@code context-graph.compression.levels}.
 */
public enum CompressionLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CompressionLevel fromKey(String key) {
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ContextValidationException("level", "Unknown compression level: " + key);
        }
    }

    /**
     * Level for a record occupying {@code currentSize / maxSize} of its budget:
     * below 0.5 low, below 0.8 medium, otherwise high.
     */
    public static CompressionLevel forUsage(long currentSize, long maxSize) {
        double ratio = (double) currentSize / maxSize;
        if (ratio < 0.5) return LOW;
        if (ratio < 0.8) return MEDIUM;
        return HIGH;
    }
}
