package com.purchasingpower.contextgraph.service.compression;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.model.compression.CompressionLevel;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps a context payload under {@code max-context-size}.
 *
 * <p>Escalation:
 * <ol>
 *   <li>above {@code max-context-size * summarization-threshold}: ratio-based
 *       summarization at the level matching the current usage</li>
 *   <li>still above the limit: emergency compression</li>
 *   <li>still above the limit: strings of the emergency payload are cut,
 *       halving their allowed length until it fits; the result is flagged truncated</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextBudgetService {

    static final int MIN_STRING_LENGTH = 16;

    private final ContextCompressionService compressionService;
    private final PayloadInspector inspector;
    private final CompressionProperties properties;
    private final Clock clock;

    public CompressionResult enforce(ContextRecord record) {
        long limit = properties.getMaxContextSize();
        long size = inspector.sizeOf(record.getPayload());
        List<String> stages = new ArrayList<>();

        if (size <= limit * properties.getSummarizationThreshold()) {
            return CompressionResult.builder()
                    .contextId(record.getId())
                    .payload(record.getPayload())
                    .strategy(CompressionStrategyType.NONE)
                    .originalSize(size)
                    .compressedSize(size)
                    .compressionRatio(1.0)
                    .compressedAt(clock.instant())
                    .metadata(Map.of("reason", "within-limit", "maxContextSize", limit))
                    .build();
        }

        CompressionLevel level = compressionService.calculateCompressionLevel(size, limit);
        CompressionResult result = compressionService.compress(record, CompressionOptions.builder()
                .strategy(CompressionStrategyType.SUMMARIZE)
                .level(level)
                .build());
        stages.add(result.getStrategy().getId());
        if (result.getCompressedSize() <= limit) {
            return finish(result, size, limit, stages);
        }

        log.warn("Context {} is {} bytes after summarization (limit {}), applying emergency compression",
                record.getId(), result.getCompressedSize(), limit);
        result = compressionService.compress(record, CompressionOptions.of(CompressionStrategyType.EMERGENCY));
        stages.add(result.getStrategy().getId());
        if (result.getCompressedSize() <= limit) {
            return finish(result, size, limit, stages);
        }

        ContextRecord emergency = record.toBuilder().payload(result.getPayload()).build();
        int maxLength = properties.getMaxSummaryLength();
        while (maxLength >= MIN_STRING_LENGTH) {
            CompressionResult cut = compressionService.compress(emergency, CompressionOptions.builder()
                    .strategy(CompressionStrategyType.TRUNCATE)
                    .maxStringLength(maxLength)
                    .build());
            if (cut.isCompressed()) {
                result = cut;
            }
            if (result.getCompressedSize() <= limit) {
                break;
            }
            maxLength /= 2;
        }
        stages.add(CompressionStrategyType.TRUNCATE.getId());
        if (result.getCompressedSize() > limit) {
            log.warn("Context {} still exceeds {} bytes after string truncation ({} bytes)",
                    record.getId(), limit, result.getCompressedSize());
        }
        return finish(result.toBuilder().truncated(true).build(), size, limit, stages);
    }

    private CompressionResult finish(CompressionResult result, long originalSize, long limit, List<String> stages) {
        Map<String, Object> metadata = new LinkedHashMap<>(result.getMetadata());
        metadata.put("stages", List.copyOf(stages));
        metadata.put("maxContextSize", limit);
        return result.toBuilder()
                .originalSize(originalSize)
                .compressionRatio(CompressionResult.ratio(originalSize, result.getCompressedSize()))
                .metadata(metadata)
                .build();
    }
}
