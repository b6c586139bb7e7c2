package com.purchasingpower.contextgraph.service.compression.impl;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.compression.CompressionLevel;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStatistics;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextLevel;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.model.graph.ContextNode;
import com.purchasingpower.contextgraph.service.compression.ContextCompressionService;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import com.purchasingpower.contextgraph.service.compression.strategy.CompressionStrategy;
import com.purchasingpower.contextgraph.service.compression.strategy.GraphAwareCompressionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ContextCompressionServiceImpl implements ContextCompressionService {

    private final Map<CompressionStrategyType, CompressionStrategy> strategies =
            new EnumMap<>(CompressionStrategyType.class);
    private final ContextGraph graph;
    private final PayloadInspector inspector;
    private final CompressionProperties properties;

    public ContextCompressionServiceImpl(List<CompressionStrategy> strategies, ContextGraph graph,
                                         PayloadInspector inspector, CompressionProperties properties) {
        strategies.forEach(s -> this.strategies.put(s.type(), s));
        this.graph = graph;
        this.inspector = inspector;
        this.properties = properties;
        log.info("Compression strategies registered: {}", this.strategies.keySet());
    }

    @Override
    public CompressionResult compress(ContextRecord record, CompressionOptions options) {
        CompressionStrategy strategy = strategies.get(options.getStrategy());
        if (strategy == null) {
            throw new ContextValidationException("strategy",
                    "No compression strategy registered for " + options.getStrategy().getId());
        }
        return strategy.compress(record, options);
    }

    @Override
    public CompressionResult compressNode(String contextId, ContextLevel level, CompressionOptions options) {
        ContextNode node = graph.getNode(contextId)
                .orElseThrow(() -> new NodeNotFoundException(contextId));
        graph.recordAccess(contextId);
        return compress(ContextRecord.fromNode(node, level), options);
    }

    @Override
    public CompressionLevel calculateCompressionLevel(long currentSize, long maxSize) {
        return CompressionLevel.forUsage(currentSize, maxSize);
    }

    @Override
    public long estimateTokens(long bytes) {
        return PayloadInspector.estimateTokens(bytes);
    }

    @Override
    public boolean needsTokenSummarization(ContextRecord record, long tokenLimit) {
        long tokens = inspector.tokensOf(record.getPayload());
        return tokens > tokenLimit * properties.getTokenWarningRatio();
    }

    @Override
    public boolean needsTokenSummarization(ContextRecord record) {
        return needsTokenSummarization(record, properties.getTokenLimit());
    }

    @Override
    public CompressionStatistics statistics() {
        return CompressionStatistics.builder()
                .levels(properties.getLevels())
                .defaultLevel(properties.getLevel())
                .ageThreshold(properties.getAgeThreshold())
                .maxSummaryLength(properties.getMaxSummaryLength())
                .useGraphAnalysis(properties.isUseGraphAnalysis())
                .graphIntegration(strategies.get(CompressionStrategyType.GRAPH_AWARE)
                        instanceof GraphAwareCompressionStrategy graphAware && graphAware.isGraphAnalysisActive())
                .build();
    }
}
