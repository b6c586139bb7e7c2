package com.purchasingpower.contextgraph.model.context;

import com.purchasingpower.contextgraph.exception.ContextValidationException;

import java.util.Map;
import java.util.Set;

/**
 * Task-level payload.
 *
 * @param status   One of pending, running, completed, failed
 * @param progress Percentage in [0,100], may be {@code null}
 */
public record TaskData(
        String taskId,
        String taskType,
        Map<String, Object> input,
        Object output,
        String status,
        Number progress,
        Object error
) implements LevelData {

    public static final Set<String> STATUSES = Set.of("pending", "running", "completed", "failed");

    @Override
    public ContextLevel level() {
        return ContextLevel.TASK;
    }

    public boolean isFinished() {
        return "completed".equals(status) || "failed".equals(status);
    }

    public static TaskData from(Map<String, Object> payload) {
        String status = LevelData.optionalString(payload, "status");
        if (status != null && !STATUSES.contains(status)) {
            throw new ContextValidationException("status", "Unknown task status: " + status);
        }
        Object progress = payload.get("progress");
        if (progress != null) {
            if (!(progress instanceof Number number)) {
                throw new ContextValidationException("progress", "'progress' must be a number");
            }
            if (number.doubleValue() < 0 || number.doubleValue() > 100) {
                throw new ContextValidationException("progress", "'progress' must be within 0..100: " + number);
            }
        }
        return new TaskData(
                LevelData.requiredString(payload, "taskId", ContextLevel.TASK),
                LevelData.requiredString(payload, "taskType", ContextLevel.TASK),
                LevelData.optionalObject(payload, "input"),
                payload.get("output"),
                status,
                (Number) progress,
                payload.get("error"));
    }
}
