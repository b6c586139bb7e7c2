package com.purchasingpower.contextgraph.model.compression;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import lombok.Value;

import java.time.Duration;

/**
 * Resolved settings of one compression level.
 */
@Value
public class CompressionPolicy {
    CompressionLevel level;
    double threshold;
    double preserveRatio;
    Duration ageThreshold;

    public static CompressionPolicy of(CompressionProperties properties, CompressionLevel level) {
        CompressionProperties.LevelSettings settings = properties.getLevels().get(level.key());
        if (settings == null) {
            throw new IllegalStateException("No settings configured for compression level " + level.key());
        }
        return new CompressionPolicy(level, settings.getThreshold(), settings.getPreserveRatio(),
                properties.getAgeThreshold());
    }
}
