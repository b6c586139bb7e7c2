package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.model.graph.GraphPosition;
import com.purchasingpower.contextgraph.service.compression.ImportanceWeights;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import com.purchasingpower.contextgraph.service.compression.WeightedPayloadCompressor;
import com.purchasingpower.contextgraph.service.graph.GraphAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Smart compression informed by the node's position in the context graph.
 *
 * <p>Central nodes keep more: field weights are scaled by
 * {@code 1 + importance + centrality*0.2}, objects keep
 * {@code ratio * (1 + centrality*0.2)} and arrays {@code ratio * (1 + centrality*0.3)}.
 * Any failure of the graph analysis falls back to plain smart compression.
 */
@Slf4j
@Component
public class GraphAwareCompressionStrategy extends AbstractCompressionStrategy {

    private static final Set<String> PROTECTED_FIELDS = Set.of("error", "status", "id");
    private static final List<String> RELATIONSHIP_KEYWORDS =
            List.of("parent", "child", "dependency", "reference", "relationship");

    private final CompressionProperties properties;
    private final SmartCompressionStrategy smartStrategy;
    private final GraphAnalyzer graphAnalyzer;

    public GraphAwareCompressionStrategy(PayloadInspector inspector, Clock clock, CompressionProperties properties,
                                         SmartCompressionStrategy smartStrategy, GraphAnalyzer graphAnalyzer) {
        super(inspector, clock);
        this.properties = properties;
        this.smartStrategy = smartStrategy;
        this.graphAnalyzer = graphAnalyzer;
    }

    @Override
    public CompressionStrategyType type() {
        return CompressionStrategyType.GRAPH_AWARE;
    }

    public boolean isGraphAnalysisActive() {
        return properties.isUseGraphAnalysis() && graphAnalyzer != null;
    }

    @Override
    protected Outcome apply(ContextRecord record, CompressionOptions options, long originalSize) {
        if (!isGraphAnalysisActive()) {
            return fallback(record, options, originalSize, "graph-analysis-disabled");
        }

        long targetTokens = smartStrategy.targetTokens(options);
        long currentTokens = PayloadInspector.estimateTokens(originalSize);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("targetTokens", targetTokens);
        metadata.put("originalTokens", currentTokens);
        if (currentTokens <= targetTokens && !properties.isForceGraphAnalysis()) {
            metadata.put("reason", "within-budget");
            return Outcome.unchanged(type(), metadata);
        }

        GraphPosition position;
        try {
            position = graphAnalyzer.analyze(record.getId());
        } catch (RuntimeException e) {
            log.error("Graph analysis failed for {}, falling back to smart compression: {}",
                    record.getId(), e.getMessage());
            return fallback(record, options, originalSize, "graph-analysis-failed");
        }

        ImportanceWeights weights = enhancedWeights(position);
        boolean connected = position.getRelationshipCount() > 0;

        Map<String, Object> graphInfo = new LinkedHashMap<>();
        graphInfo.put("graphAware", true);
        graphInfo.put("centralityScore", position.getCentralityScore());
        graphInfo.put("relationshipCount", position.getRelationshipCount());

        WeightedPayloadCompressor compressor = new WeightedPayloadCompressor(
                key -> connected && isRelationshipKey(key)
                        ? Math.min(weights.weightOf(key) * 1.3, 1.0)
                        : weights.weightOf(key),
                properties.getPreserveKeys(),
                properties.getLongStringThreshold(),
                position.getCentralityScore() * 0.2,
                position.getCentralityScore() * 0.3,
                graphInfo);

        double ratio = Math.min((double) targetTokens / currentTokens, 1.0);
        Map<String, Object> payload = compressor.compressObject(record.getPayload(), ratio);

        metadata.put("finalTokens", inspector.tokensOf(payload));
        metadata.put("centralityScore", position.getCentralityScore());
        metadata.put("relationshipCount", position.getRelationshipCount());
        metadata.put("importance", position.getImportance());
        return Outcome.of(payload, type(), metadata);
    }

    /**
     * Base weights scaled by graph position; protected fields keep their base weight.
     */
    static ImportanceWeights enhancedWeights(GraphPosition position) {
        double enhancement = position.getImportance();
        double centralityBonus = position.getCentralityScore() * 0.2;

        Map<String, Double> enhanced = new LinkedHashMap<>();
        ImportanceWeights.graphBase().forEach((key, weight) -> enhanced.put(key,
                PROTECTED_FIELDS.contains(key)
                        ? weight
                        : Math.min(weight * (1 + enhancement + centralityBonus), 1.0)));

        if (position.getRelationshipCount() > 0) {
            enhanced.put("parentId", 0.9);
            enhanced.put("children", 0.8);
            enhanced.put("dependencies", 0.8);
            enhanced.put("references", 0.7);
        }
        return new ImportanceWeights(enhanced);
    }

    private static boolean isRelationshipKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return RELATIONSHIP_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private Outcome fallback(ContextRecord record, CompressionOptions options, long originalSize, String reason) {
        Outcome smart = smartStrategy.apply(record, options, originalSize);
        Map<String, Object> metadata = new LinkedHashMap<>(smart.metadata());
        metadata.put("fallback", reason);
        return new Outcome(smart.payload(), CompressionStrategyType.SMART, metadata, smart.truncated());
    }
}
