package com.purchasingpower.contextgraph.configuration;

import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the in-memory graph and exposes each section of
 * {@link ContextGraphProperties} as its own bean, so services depend only on
 * the settings they read.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ContextGraphProperties.class)
public class ContextGraphConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GraphProperties graphProperties(ContextGraphProperties properties) {
        return properties.getGraph();
    }

    @Bean
    public CompressionProperties compressionProperties(ContextGraphProperties properties) {
        return properties.getCompression();
    }

    @Bean
    public BatchProperties batchProperties(ContextGraphProperties properties) {
        return properties.getBatch();
    }

    @Bean
    public PersistenceProperties persistenceProperties(ContextGraphProperties properties) {
        return properties.getPersistence();
    }

    @Bean
    public ContextGraph contextGraph(GraphProperties graph, Clock clock) {
        log.info("Context graph created (defaultEdgeWeight={}, maxTraversalDepth={})",
                graph.getDefaultEdgeWeight(), graph.getMaxTraversalDepth());
        return new ContextGraph(graph.getDefaultEdgeWeight(), clock);
    }
}
