package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.service.compression.ImportanceWeights;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import com.purchasingpower.contextgraph.service.compression.WeightedPayloadCompressor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Budget-targeted compression: keeps the most important fields in proportion
 * {@code targetTokens / currentTokens}. Records already within budget are
 * returned as given.
 */
@Component
public class SmartCompressionStrategy extends AbstractCompressionStrategy {

    private final CompressionProperties properties;
    private final ImportanceWeights weights;

    public SmartCompressionStrategy(PayloadInspector inspector, Clock clock, CompressionProperties properties) {
        super(inspector, clock);
        this.properties = properties;
        this.weights = properties.getImportanceWeights().isEmpty()
                ? ImportanceWeights.defaults()
                : new ImportanceWeights(properties.getImportanceWeights());
    }

    @Override
    public CompressionStrategyType type() {
        return CompressionStrategyType.SMART;
    }

    @Override
    protected Outcome apply(ContextRecord record, CompressionOptions options, long originalSize) {
        long targetTokens = targetTokens(options);
        long currentTokens = PayloadInspector.estimateTokens(originalSize);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("targetTokens", targetTokens);
        metadata.put("originalTokens", currentTokens);
        if (currentTokens <= targetTokens) {
            metadata.put("reason", "within-budget");
            return Outcome.unchanged(type(), metadata);
        }

        double ratio = (double) targetTokens / currentTokens;
        WeightedPayloadCompressor compressor = new WeightedPayloadCompressor(weights::weightOf,
                properties.getPreserveKeys(), properties.getLongStringThreshold(), 0.0, 0.0, Map.of());
        Map<String, Object> payload = compressor.compressObject(record.getPayload(), ratio);

        metadata.put("finalTokens", inspector.tokensOf(payload));
        return Outcome.of(payload, type(), metadata);
    }

    long targetTokens(CompressionOptions options) {
        long target = options.getTargetTokens() != null ? options.getTargetTokens() : properties.getDefaultTargetTokens();
        if (target <= 0) {
            throw new ContextValidationException("targetTokens", "'targetTokens' must be positive: " + target);
        }
        return target;
    }
}
