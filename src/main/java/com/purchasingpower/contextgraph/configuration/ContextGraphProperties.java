package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the {@code context-graph} configuration namespace.
 *
 * <pre>
 * context-graph:
 *   graph:
 *     impact-decay-factor: 0.8
 *   compression:
 *     level: medium
 *     age-threshold: 30m
 *   batch:
 *     chunk-size: 3
 *   persistence:
 *     enabled: false
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "context-graph")
public class ContextGraphProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CompressionProperties compression = new CompressionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private BatchProperties batch = new BatchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();
}
