package com.purchasingpower.contextgraph.service.compression.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.model.compression.CompressionLevel;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextLevel;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Ratio-Based Summarization Tests")
class RatioSummarizationStrategyTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant AN_HOUR_AGO = NOW.minus(Duration.ofHours(1));

    private RatioSummarizationStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new RatioSummarizationStrategy(new PayloadInspector(new ObjectMapper()),
                Clock.fixed(NOW, ZoneOffset.UTC), new CompressionProperties());
    }

    @Test
    @DisplayName("Should keep the first 2 and the latest 8 of 50 history entries at level high")
    void historyRetention() {
        List<Object> history = IntStream.range(0, 50).<Object>mapToObj(i -> "entry-" + i).toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", "agent-7");
        payload.put("agentType", "reviewer");
        payload.put("history", history);

        CompressionResult result = strategy.compress(record(ContextLevel.AGENT, payload, AN_HOUR_AGO),
                options(CompressionLevel.HIGH));

        assertThat(result.isCompressed()).isTrue();
        assertThat(result.getStrategy()).isEqualTo(CompressionStrategyType.SUMMARIZE);
        @SuppressWarnings("unchecked")
        List<Object> kept = (List<Object>) result.getPayload().get("history");
        assertThat(kept).hasSize(10);
        assertThat(kept.subList(0, 2)).containsExactly("entry-0", "entry-1");
        assertThat(kept.subList(2, 10)).containsExactlyElementsOf(history.subList(42, 50));
        assertThat(result.getPayload()).containsEntry("agentId", "agent-7");
        assertThat(result.getCompressedSize()).isLessThan(result.getOriginalSize());
    }

    @Test
    @DisplayName("Should return a fresh record untouched")
    void belowAgeThreshold() {
        Map<String, Object> payload = Map.of("agentId", "a", "agentType", "t", "history", List.of(1, 2, 3, 4, 5));
        ContextRecord fresh = record(ContextLevel.AGENT, payload, NOW.minusSeconds(60));

        CompressionResult result = strategy.compress(fresh, options(CompressionLevel.HIGH));

        assertThat(result.isCompressed()).isFalse();
        assertThat(result.getPayload()).isSameAs(payload);
        assertThat(result.getCompressionRatio()).isEqualTo(1.0);
        assertThat(result.getMetadata()).containsEntry("reason", "below-age-threshold");
    }

    @Test
    @DisplayName("Should never summarize global contexts")
    void globalUnchanged() {
        Map<String, Object> payload = Map.of("systemConfig", Map.of("mode", "strict", "region", "eu"));

        CompressionResult result = strategy.compress(record(ContextLevel.GLOBAL, payload, AN_HOUR_AGO),
                options(CompressionLevel.HIGH));

        assertThat(result.isCompressed()).isFalse();
        assertThat(result.getPayload()).isSameAs(payload);
        assertThat(result.getMetadata()).containsEntry("reason", "global-context");
    }

    @Test
    @DisplayName("Should keep configured must-keep fields of an unfinished task")
    void mustKeepFields() {
        Map<String, Object> input = new LinkedHashMap<>();
        IntStream.range(0, 10).forEach(i -> input.put("param" + i, "value-" + "x".repeat(i * 10)));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", "task-1");
        payload.put("taskType", "build");
        payload.put("status", "running");
        payload.put("output", "partial log");
        payload.put("input", input);

        CompressionResult result = strategy.compress(record(ContextLevel.TASK, payload, AN_HOUR_AGO),
                options(CompressionLevel.MEDIUM));

        assertThat(result.getPayload())
                .containsEntry("status", "running")
                .containsEntry("output", "partial log");
        @SuppressWarnings("unchecked")
        Map<String, Object> keptInput = (Map<String, Object>) result.getPayload().get("input");
        assertThat(keptInput).containsKeys("param0", "param4").doesNotContainKey("param9");
    }

    @Test
    @DisplayName("Should keep the smallest keys of a record without a level")
    void untypedRecord() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", "ctx-1");
        payload.put("small", "a");
        payload.put("medium", "a".repeat(100));
        payload.put("large", "a".repeat(1000));
        payload.put("huge", "a".repeat(5000));

        CompressionResult result = strategy.compress(record(null, payload, AN_HOUR_AGO),
                options(CompressionLevel.MEDIUM));

        assertThat(result.getPayload()).containsKeys("id", "small", "medium").doesNotContainKeys("large", "huge");
        assertThat(result.getPayload()).containsKey("_summary");
    }

    @Test
    @DisplayName("Should reject a task with an unknown status")
    void invalidTask() {
        Map<String, Object> payload = Map.of("taskId", "t", "taskType", "build", "status", "paused");

        assertThatThrownBy(() -> strategy.compress(record(ContextLevel.TASK, payload, AN_HOUR_AGO),
                options(CompressionLevel.LOW)))
                .isInstanceOf(ContextValidationException.class)
                .hasMessageContaining("paused");
    }

    @Test
    @DisplayName("Should keep everything when the ratio covers the whole history")
    void retainHistory_smallHistory() {
        List<Object> history = new ArrayList<>(List.of("a", "b", "c"));

        assertThat(RatioSummarizationStrategy.retainHistory(history, 0.8)).containsExactly("a", "b", "c");
        assertThat(RatioSummarizationStrategy.retainHistory(history, 0.2)).containsExactly("a", "b");
    }

    private static ContextRecord record(ContextLevel level, Map<String, Object> payload, Instant createdAt) {
        return ContextRecord.builder()
                .id("ctx")
                .level(level)
                .payload(payload)
                .createdAt(createdAt)
                .build();
    }

    private static CompressionOptions options(CompressionLevel level) {
        return CompressionOptions.builder()
                .strategy(CompressionStrategyType.SUMMARIZE)
                .level(level)
                .build();
    }
}
