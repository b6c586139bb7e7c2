package com.purchasingpower.contextgraph.model.compression;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.contextgraph.exception.ContextValidationException;

import java.util.Arrays;

public enum CompressionStrategyType {
    /** Nothing was applied */
    NONE("none"),

    /** Age-gated, preserve-ratio key selection, typed per context level */
    SUMMARIZE("summarize"),

    /** Head/tail shortening of long strings */
    TRUNCATE("truncate"),

    /** Importance-ranked selection toward a token budget */
    SMART("smart"),

    /** Smart selection boosted by the node's graph position */
    GRAPH_AWARE("graph-aware"),

    /** Fixed minimal field set per level */
    EMERGENCY("emergency");

    private final String id;

    CompressionStrategyType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static CompressionStrategyType fromId(String value) {
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ContextValidationException("strategy", "Unknown compression strategy: " + value));
    }
}
