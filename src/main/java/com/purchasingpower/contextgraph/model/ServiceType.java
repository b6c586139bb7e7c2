package com.purchasingpower.contextgraph.model;

/**
 * Collaborators whose calls are logged through {@link com.purchasingpower.contextgraph.util.ExternalCallLogger}.
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    WORKER_POOL("🟣", "CompressionPool");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
