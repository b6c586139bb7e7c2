package com.purchasingpower.contextgraph.service.compression;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.configuration.GraphProperties;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.service.compression.impl.ContextCompressionServiceImpl;
import com.purchasingpower.contextgraph.service.compression.strategy.EmergencyCompressionStrategy;
import com.purchasingpower.contextgraph.service.compression.strategy.GraphAwareCompressionStrategy;
import com.purchasingpower.contextgraph.service.compression.strategy.RatioSummarizationStrategy;
import com.purchasingpower.contextgraph.service.compression.strategy.SmartCompressionStrategy;
import com.purchasingpower.contextgraph.service.compression.strategy.TextTruncationStrategy;
import com.purchasingpower.contextgraph.service.graph.impl.GraphAnalyzerImpl;
import com.purchasingpower.contextgraph.service.graph.impl.GraphTraversalServiceImpl;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Builds the compression engine with every strategy, as the application context wires it.
 */
public final class CompressionTestSupport {

    public static final PayloadInspector INSPECTOR = new PayloadInspector(new ObjectMapper().findAndRegisterModules());

    private CompressionTestSupport() {
    }

    public static ContextCompressionServiceImpl compressionService(ContextGraph graph, CompressionProperties properties,
                                                                   Clock clock) {
        SmartCompressionStrategy smart = new SmartCompressionStrategy(INSPECTOR, clock, properties);
        GraphAnalyzerImpl analyzer = new GraphAnalyzerImpl(graph,
                new GraphTraversalServiceImpl(graph, new GraphProperties()), properties);
        return new ContextCompressionServiceImpl(List.of(
                new RatioSummarizationStrategy(INSPECTOR, clock, properties),
                new TextTruncationStrategy(INSPECTOR, clock, properties),
                smart,
                new GraphAwareCompressionStrategy(INSPECTOR, clock, properties, smart, analyzer),
                new EmergencyCompressionStrategy(INSPECTOR, clock)),
                graph, INSPECTOR, properties);
    }

    /**
     * A record payload of roughly 2,500 tokens: three must-keep fields plus bulky logs, scratch text and history.
     */
    public static Map<String, Object> largePayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", "ctx-1");
        payload.put("status", "running");
        payload.put("output", "done");
        payload.put("logs", IntStream.range(0, 100).<Object>mapToObj(i -> "log line " + i + " with detail").toList());
        payload.put("tempData", "x".repeat(4000));
        payload.put("history", IntStream.range(0, 50).<Object>mapToObj(i -> "step-" + i).toList());
        return payload;
    }
}
