package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.ContextLevel;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import com.purchasingpower.contextgraph.service.compression.TextTruncator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last resort: replaces the payload with a fixed minimal field set for its
 * level. Ratios and budgets are ignored. Lenient about shape; missing fields
 * get placeholders.
 */
@Slf4j
@Component
public class EmergencyCompressionStrategy extends AbstractCompressionStrategy {

    static final int OUTPUT_LIMIT = 200;

    public EmergencyCompressionStrategy(PayloadInspector inspector, Clock clock) {
        super(inspector, clock);
    }

    @Override
    public CompressionStrategyType type() {
        return CompressionStrategyType.EMERGENCY;
    }

    @Override
    protected Outcome apply(ContextRecord record, CompressionOptions options, long originalSize) {
        log.warn("Emergency compression triggered for {} ({} bytes)", record.getId(), originalSize);

        Map<String, Object> data = record.getPayload();
        ContextLevel level = record.getLevel();
        Map<String, Object> payload;
        if (level == ContextLevel.AGENT) {
            payload = agent(record.getId(), data);
        } else if (level == ContextLevel.TASK) {
            payload = task(record.getId(), data);
        } else if (level == ContextLevel.PROJECT) {
            payload = project(data);
        } else {
            payload = new LinkedHashMap<>();
            payload.put("summary", "Emergency summarized context");
            if (level != null) {
                payload.put("originalLevel", level.name());
            }
            payload.put("criticalData", firstPresent(data.get("error"), data.get("output")));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("emergency", true);
        if (level != null) {
            metadata.put("contextLevel", level.name());
        }
        return Outcome.of(payload, type(), metadata);
    }

    private Map<String, Object> agent(String id, Map<String, Object> data) {
        Map<String, Object> state = data.get("state") instanceof Map<?, ?> s ? asMap(s) : Map.of();

        Map<String, Object> essentialState = new LinkedHashMap<>();
        essentialState.put("status", firstPresent(state.get("status"), data.get("status"), "unknown"));
        putIfPresent(essentialState, "error", firstPresent(state.get("error"), data.get("error")));
        putIfPresent(essentialState, "progress", firstPresent(state.get("progress"), data.get("progress")));
        essentialState.put("summary", "Emergency summarized - essential state only");

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agentId", firstPresent(data.get("agentId"), id));
        out.put("agentType", firstPresent(data.get("agentType"), "unknown"));
        out.put("state", essentialState);

        Object output = data.get("output");
        if (output != null) {
            Object result = output instanceof Map<?, ?> o
                    ? firstPresent(o.get("result"), "Emergency summarized output")
                    : truncate(String.valueOf(output), OUTPUT_LIMIT);
            out.put("output", Map.of("result", result));
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", clock.instant().toString());
        entry.put("action", "emergency_summarization");
        entry.put("details", "Context emergency summarized due to size limits");
        out.put("history", List.of(entry));
        out.put("capabilities", firstPresent(data.get("capabilities"), List.of()));
        return out;
    }

    private Map<String, Object> task(String id, Map<String, Object> data) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("taskId", firstPresent(data.get("taskId"), id));
        out.put("taskType", firstPresent(data.get("taskType"), "unknown"));
        out.put("input", data.get("input") != null ? Map.of("summary", "Emergency summarized input") : Map.of());
        if (data.get("output") != null) {
            out.put("output", TextTruncator.extractKeyPoints(inspector.toJson(data.get("output")), OUTPUT_LIMIT));
        }
        out.put("status", firstPresent(data.get("status"), "unknown"));
        out.put("progress", firstPresent(data.get("progress"), 0));
        putIfPresent(out, "error", data.get("error"));
        return out;
    }

    private static Map<String, Object> project(Map<String, Object> data) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("projectName", firstPresent(data.get("projectName"), "Unnamed Project"));
        out.put("projectPath", firstPresent(data.get("projectPath"), "."));
        out.put("config", Map.of("emergency", true));
        out.put("activeAgents", firstPresent(data.get("activeAgents"), List.of()));
        out.put("sharedState", Map.of("emergency", "summarized"));
        return out;
    }

    private static Object firstPresent(Object... candidates) {
        for (Object candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
