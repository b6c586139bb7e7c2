package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.service.compression.KeyPreserver;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import com.purchasingpower.contextgraph.service.compression.WeightedPayloadCompressor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Measures the payload, runs {@link #apply}, and guarantees the result is no
 * larger than the input: annotations are stripped first, and if that is not
 * enough the input is returned unchanged.
 */
@Slf4j
public abstract class AbstractCompressionStrategy implements CompressionStrategy {

    private static final Set<String> ANNOTATION_KEYS = Set.of(
            KeyPreserver.SUMMARY_KEY, WeightedPayloadCompressor.SUMMARY_KEY, "historySummary");

    protected final PayloadInspector inspector;
    protected final Clock clock;

    protected AbstractCompressionStrategy(PayloadInspector inspector, Clock clock) {
        this.inspector = inspector;
        this.clock = clock;
    }

    @Override
    public final CompressionResult compress(ContextRecord record, CompressionOptions options) {
        long originalSize = inspector.sizeOf(record.getPayload());
        Outcome outcome = apply(record, options, originalSize);

        if (outcome.payload() == null) {
            log.debug("{} left {} unchanged ({} bytes): {}", outcome.strategy().getId(), record.getId(),
                    originalSize, outcome.metadata());
            return unchanged(record, outcome.strategy(), originalSize, outcome.metadata());
        }

        Map<String, Object> payload = outcome.payload();
        long size = inspector.sizeOf(payload);
        if (size > originalSize) {
            payload = stripAnnotations(payload);
            size = inspector.sizeOf(payload);
        }
        if (size > originalSize) {
            Map<String, Object> metadata = new LinkedHashMap<>(outcome.metadata());
            metadata.put("reason", "no-gain");
            log.debug("{} would grow {} from {} to {} bytes, keeping original",
                    outcome.strategy().getId(), record.getId(), originalSize, size);
            return unchanged(record, outcome.strategy(), originalSize, metadata);
        }

        CompressionResult result = CompressionResult.builder()
                .contextId(record.getId())
                .payload(payload)
                .strategy(outcome.strategy())
                .originalSize(originalSize)
                .compressedSize(size)
                .compressionRatio(CompressionResult.ratio(originalSize, size))
                .compressedAt(clock.instant())
                .compressed(true)
                .truncated(outcome.truncated())
                .metadata(outcome.metadata())
                .build();

        log.info("Context {} compressed with {}: {} -> {} bytes (ratio {})", record.getId(),
                outcome.strategy().getId(), originalSize, size, String.format("%.3f", result.getCompressionRatio()));
        return result;
    }

    /**
     * @return the compressed payload, or an unchanged outcome when nothing should be done
     */
    protected abstract Outcome apply(ContextRecord record, CompressionOptions options, long originalSize);

    private CompressionResult unchanged(ContextRecord record, CompressionStrategyType strategy, long size,
                                        Map<String, Object> metadata) {
        return CompressionResult.builder()
                .contextId(record.getId())
                .payload(record.getPayload())
                .strategy(strategy)
                .originalSize(size)
                .compressedSize(size)
                .compressionRatio(1.0)
                .compressedAt(clock.instant())
                .compressed(false)
                .metadata(metadata)
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> stripAnnotations(Map<String, Object> object) {
        Map<String, Object> stripped = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : object.entrySet()) {
            if (ANNOTATION_KEYS.contains(entry.getKey())) {
                continue;
            }
            Object value = entry.getValue();
            if (value instanceof Map) {
                value = stripAnnotations((Map<String, Object>) value);
            } else if (value instanceof List<?> list) {
                value = list.stream()
                        .map(item -> item instanceof Map ? stripAnnotations((Map<String, Object>) item) : item)
                        .toList();
            }
            stripped.put(entry.getKey(), value);
        }
        return stripped;
    }

    /**
     * What a strategy produced. A {@code null} payload means "return the input".
     */
    protected record Outcome(Map<String, Object> payload, CompressionStrategyType strategy,
                             Map<String, Object> metadata, boolean truncated) {

        static Outcome of(Map<String, Object> payload, CompressionStrategyType strategy,
                          Map<String, Object> metadata) {
            return new Outcome(payload, strategy, metadata, false);
        }

        static Outcome unchanged(CompressionStrategyType strategy, Map<String, Object> metadata) {
            return new Outcome(null, strategy, metadata, false);
        }
    }
}
