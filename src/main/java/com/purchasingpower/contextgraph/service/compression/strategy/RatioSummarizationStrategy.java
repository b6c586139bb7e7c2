package com.purchasingpower.contextgraph.service.compression.strategy;

import com.purchasingpower.contextgraph.configuration.CompressionProperties;
import com.purchasingpower.contextgraph.model.compression.CompressionLevel;
import com.purchasingpower.contextgraph.model.compression.CompressionOptions;
import com.purchasingpower.contextgraph.model.compression.CompressionPolicy;
import com.purchasingpower.contextgraph.model.compression.CompressionStrategyType;
import com.purchasingpower.contextgraph.model.context.AgentData;
import com.purchasingpower.contextgraph.model.context.ContextRecord;
import com.purchasingpower.contextgraph.model.context.GlobalData;
import com.purchasingpower.contextgraph.model.context.LevelData;
import com.purchasingpower.contextgraph.model.context.ProjectData;
import com.purchasingpower.contextgraph.model.context.TaskData;
import com.purchasingpower.contextgraph.service.compression.KeyPreserver;
import com.purchasingpower.contextgraph.service.compression.PayloadInspector;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Age-gated summarization at a named compression level.
 *
 * <p>Records younger than the age threshold are returned as given. Older
 * records are reduced by the level's preserve ratio, with a bespoke field list
 * per context level. Global records are never summarized.
 */
@Component
public class RatioSummarizationStrategy extends AbstractCompressionStrategy {

    private final CompressionProperties properties;

    public RatioSummarizationStrategy(PayloadInspector inspector, Clock clock, CompressionProperties properties) {
        super(inspector, clock);
        this.properties = properties;
    }

    @Override
    public CompressionStrategyType type() {
        return CompressionStrategyType.SUMMARIZE;
    }

    @Override
    protected Outcome apply(ContextRecord record, CompressionOptions options, long originalSize) {
        CompressionLevel level = options.getLevel() != null
                ? options.getLevel()
                : CompressionLevel.fromKey(properties.getLevel());
        CompressionPolicy policy = CompressionPolicy.of(properties, level);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("level", level.key());
        metadata.put("preserveRatio", policy.getPreserveRatio());
        if (record.getLevel() != null) {
            metadata.put("contextLevel", record.getLevel().name());
        }

        Duration age = Duration.between(record.getCreatedAt(), clock.instant());
        if (age.compareTo(policy.getAgeThreshold()) < 0) {
            metadata.put("reason", "below-age-threshold");
            return Outcome.unchanged(type(), metadata);
        }

        Map<String, Object> payload = record.getPayload();
        double ratio = policy.getPreserveRatio();
        KeyPreserver preserver = new KeyPreserver(properties.getPreserveKeys(), inspector);

        Map<String, Object> summarized;
        if (record.getLevel() == null) {
            summarized = preserver.preserve(payload, ratio);
        } else {
            LevelData data = LevelData.parse(record.getLevel(), payload);
            if (data instanceof GlobalData) {
                metadata.put("reason", "global-context");
                return Outcome.unchanged(type(), metadata);
            } else if (data instanceof AgentData agent) {
                summarized = summarizeAgent(agent, ratio, preserver);
            } else if (data instanceof TaskData task) {
                summarized = summarizeTask(task, ratio, preserver);
            } else {
                summarized = summarizeProject((ProjectData) data, ratio, preserver);
            }
            for (String key : properties.getPreserveKeys()) {
                if (payload.containsKey(key) && !summarized.containsKey(key)) {
                    summarized.put(key, payload.get(key));
                }
            }
        }
        return Outcome.of(summarized, type(), metadata);
    }

    private Map<String, Object> summarizeAgent(AgentData agent, double ratio, KeyPreserver preserver) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agentId", agent.agentId());
        out.put("agentType", agent.agentType());
        putIfPresent(out, "state", preserver.preserve(agent.state(), ratio));
        putIfPresent(out, "capabilities", agent.capabilities());

        if (agent.history() != null) {
            List<Object> history = retainHistory(agent.history(), ratio);
            out.put("history", history);
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("totalEntries", agent.history().size());
            summary.put("preserved", history.size());
            summary.put("summarized", true);
            out.put("historySummary", summary);
        }
        return out;
    }

    /**
     * The first two entries plus the most recent {@code ceil(n * ratio) - 2}.
     */
    static List<Object> retainHistory(List<Object> history, double ratio) {
        int size = history.size();
        int keepCount = (int) Math.ceil(size * ratio);
        if (keepCount >= size) {
            return new ArrayList<>(history);
        }
        int head = Math.min(2, size);
        int tailStart = Math.max(head, size - Math.max(0, keepCount - 2));
        List<Object> retained = new ArrayList<>(history.subList(0, head));
        retained.addAll(history.subList(tailStart, size));
        return retained;
    }

    private Map<String, Object> summarizeTask(TaskData task, double ratio, KeyPreserver preserver) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("taskId", task.taskId());
        out.put("taskType", task.taskType());
        putIfPresent(out, "status", task.status());
        putIfPresent(out, "progress", task.progress());
        if (task.isFinished()) {
            putIfPresent(out, "output", task.output());
            putIfPresent(out, "error", task.error());
        }
        putIfPresent(out, "input", preserver.preserve(task.input(), ratio));
        return out;
    }

    private Map<String, Object> summarizeProject(ProjectData project, double ratio, KeyPreserver preserver) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("projectName", project.projectName());
        putIfPresent(out, "projectPath", project.projectPath());
        putIfPresent(out, "activeAgents", project.activeAgents());
        putIfPresent(out, "config", preserver.preserve(project.config(), ratio));
        putIfPresent(out, "sharedState", preserver.preserve(project.sharedState(), ratio));
        return out;
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
