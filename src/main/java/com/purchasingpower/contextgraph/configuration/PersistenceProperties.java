package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class PersistenceProperties {

    /**
     * Mirrors the in-memory graph to Neo4j when true.
     */
    private boolean enabled = false;

    @NotBlank
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "password";

    @NotBlank
    private String database = "neo4j";

    @Min(1)
    private int maxConnectionPoolSize = 50;

    @NotNull
    private Duration connectionAcquisitionTimeout = Duration.ofSeconds(60);

    /**
     * Upper bound for one mirrored write; slower calls are abandoned.
     */
    @NotNull
    private Duration callTimeout = Duration.ofSeconds(5);

    /**
     * Deployment environment name. {@code production} disables destructive calls.
     */
    @NotBlank
    private String environment = "development";

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }
}
