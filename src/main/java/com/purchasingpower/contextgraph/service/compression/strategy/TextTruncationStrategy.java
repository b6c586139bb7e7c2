package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import com.purchasingpower.contextgraph.service.compression.TextTruncator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shortens every string longer than the configured maximum to its head and
 * tail, at any depth. Keys and structure are untouched.
 */
@Component
public class TextTruncationStrategy extends AbstractCompressionStrategy {

    private final CompressionProperties properties;

    public TextTruncationStrategy(PayloadInspector inspector, Clock clock, CompressionProperties properties) {
        super(inspector, clock);
        this.properties = properties;
    }

    @Override
    public CompressionStrategyType type() {
        return CompressionStrategyType.TRUNCATE;
    }

    @Override
    protected Outcome apply(ContextRecord record, CompressionOptions options, long originalSize) {
        int maxLength = options.getMaxStringLength() != null
                ? options.getMaxStringLength()
                : properties.getMaxSummaryLength();
        if (maxLength < 0) {
            throw new ContextValidationException("maxStringLength", "'maxStringLength' must not be negative: " + maxLength);
        }

        int[] shortened = {0};
        Object truncated = truncate(record.getPayload(), maxLength, shortened);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("maxStringLength", maxLength);
        metadata.put("truncatedStrings", shortened[0]);
        if (shortened[0] == 0) {
            return Outcome.unchanged(type(), metadata);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) truncated;
        return new Outcome(payload, type(), metadata, true);
    }

    private Object truncate(Object value, int maxLength, int[] shortened) {
        if (value instanceof String text) {
            String result = TextTruncator.shorten(text, maxLength);
            if (!result.equals(text)) {
                shortened[0]++;
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), truncate(v, maxLength, shortened)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(truncate(item, maxLength, shortened)));
            return copy;
        }
        return value;
    }
}
