package com.purchasingpower.contextgraph.service.compression;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.knowledge.ContextGraph;
import com.purchasingpower.contextgraph.model.compression.CompressionResult;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextLevel;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Context Size Limit Tests")
class ContextBudgetServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant YESTERDAY = NOW.minus(Duration.ofDays(1));
    private static final int LIMIT = 1400;

    private ContextBudgetService budgetService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        CompressionProperties properties = new CompressionProperties();
        properties.setMaxContextSize(LIMIT);
        budgetService = new ContextBudgetService(
                CompressionTestSupport.compressionService(new ContextGraph(), properties, clock),
                CompressionTestSupport.INSPECTOR, properties, clock);
    }

    @Test
    @DisplayName("Should leave a record below the summarization threshold alone")
    void withinLimit() {
        Map<String, Object> payload = Map.of("agentId", "a", "agentType", "t");

        CompressionResult result = budgetService.enforce(agent(payload));

        assertThat(result.getStrategy()).isEqualTo(CompressionStrategyType.NONE);
        assertThat(result.isCompressed()).isFalse();
        assertThat(result.getPayload()).isSameAs(payload);
    }

    @Test
    @DisplayName("Should summarize at the level matching the usage")
    void summarizes() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", "agent-1");
        payload.put("agentType", "planner");
        payload.put("history", IntStream.range(0, 100).<Object>mapToObj(i -> String.format("entry-%03d", i)).toList());
        long originalSize = CompressionTestSupport.INSPECTOR.sizeOf(payload);
        assertThat(originalSize).isBetween((long) (LIMIT * 0.8), (long) LIMIT);

        CompressionResult result = budgetService.enforce(agent(payload));

        assertThat(result.getStrategy()).isEqualTo(CompressionStrategyType.SUMMARIZE);
        assertThat(result.getMetadata()).containsEntry("level", "high");
        assertThat(result.getMetadata().get("stages")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly("summarize");
        assertThat(result.getCompressedSize()).isLessThanOrEqualTo(LIMIT);
        assertThat(result.getOriginalSize()).isEqualTo(originalSize);
    }

    @Test
    @DisplayName("Should escalate to emergency compression when summarization is not enough")
    void escalatesToEmergency() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", "task-1");
        payload.put("taskType", "build");
        payload.put("status", "running");
        payload.put("output", "o".repeat(5000));

        CompressionResult result = budgetService.enforce(ContextRecord.builder()
                .id("task-1")
                .level(ContextLevel.TASK)
                .payload(payload)
                .createdAt(YESTERDAY)
                .build());

        assertThat(result.getStrategy()).isEqualTo(CompressionStrategyType.EMERGENCY);
        assertThat(result.getMetadata().get("stages")).asInstanceOf(InstanceOfAssertFactories.LIST).containsExactly("summarize", "emergency");
        assertThat(result.getCompressedSize()).isLessThanOrEqualTo(LIMIT);
        assertThat(result.getPayload()).containsEntry("status", "running");
    }

    @Test
    @DisplayName("Should cut strings of the emergency payload as a last resort")
    void truncatesLastResort() {
        Map<String, Object> payload = Map.of("agentId", "agent-1", "agentType", "t".repeat(6000));

        CompressionResult result = budgetService.enforce(agent(payload));

        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getMetadata().get("stages")).asInstanceOf(InstanceOfAssertFactories.LIST)
                .containsExactly("summarize", "emergency", "truncate");
        assertThat(result.getCompressedSize()).isLessThanOrEqualTo(LIMIT);
        assertThat(result.getCompressionRatio()).isLessThan(1.0);
    }

    private static ContextRecord agent(Map<String, Object> payload) {
        return ContextRecord.builder()
                .id("agent-1")
                .level(ContextLevel.AGENT)
                .payload(payload)
                .createdAt(YESTERDAY)
                .build();
    }
}
