package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class CompressionProperties {

    /**
     * Level used by ratio-based summarization when the caller names none.
     */
    @NotNull
    private String level = "medium";

    /**
     * Contexts younger than this are returned at full fidelity.
     */
    @NotNull
    private Duration ageThreshold = Duration.ofMinutes(30);

    /**
     * Top-level keys that survive every ratio-based and smart compression.
     */
    @NotNull
    private List<String> preserveKeys = new ArrayList<>(List.of("id", "status", "error", "output"));

    @Min(16)
    private int maxSummaryLength = 1000;

    /**
     * Strings longer than this are shortened by the smart strategies.
     */
    @Min(16)
    private int longStringThreshold = 1000;

    private boolean useGraphAnalysis = true;

    /**
     * Run graph-aware compression even when the record is already within
     * budget. Off by default.
     */
    private boolean forceGraphAnalysis = false;

    @Valid
    @NotNull
    private Map<String, LevelSettings> levels = defaultLevels();

    @NotNull
    private Map<String, Double> relationshipImportance = new LinkedHashMap<>(Map.of(
            "parent", 1.0,
            "depends-on", 0.9,
            "executes", 0.8,
            "references", 0.7,
            "child", 0.6));

    /**
     * Field name to weight in [0,1]; empty selects the built-in table.
     */
    @NotNull
    private Map<String, Double> importanceWeights = new LinkedHashMap<>();

    @Min(1)
    private int defaultTargetTokens = 20000;

    @Min(1)
    private int tokenLimit = 25000;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double tokenWarningRatio = 0.8;

    /**
     * Hard size limit of one context payload, in bytes.
     */
    @Min(256)
    private int maxContextSize = 100_000;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double summarizationThreshold = 0.8;

    @Data
    public static class LevelSettings {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double preserveRatio;

        public LevelSettings() {
        }

        public LevelSettings(double threshold, double preserveRatio) {
            this.threshold = threshold;
            this.preserveRatio = preserveRatio;
        }
    }

    private static Map<String, LevelSettings> defaultLevels() {
        Map<String, LevelSettings> levels = new LinkedHashMap<>();
        levels.put("low", new LevelSettings(0.3, 0.8));
        levels.put("medium", new LevelSettings(0.5, 0.5));
        levels.put("high", new LevelSettings(0.7, 0.2));
        return levels;
    }
}
