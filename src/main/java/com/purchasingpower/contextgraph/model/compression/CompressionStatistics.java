package com.purchasingpower.contextgraph.model.compression;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

@Value
@Builder
public class CompressionStatistics {
    Map<String, CompressionProperties.LevelSettings> levels;
    String defaultLevel;
    Duration ageThreshold;
    int maxSummaryLength;
    boolean useGraphAnalysis;
    boolean graphIntegration;
}
