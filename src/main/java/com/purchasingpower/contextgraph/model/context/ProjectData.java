package com.purchasingpower.contextgraph.model.context;

import java.util.List;
import java.util.Map;

/**
 * Project-level payload.
 */
public record ProjectData(
        String projectName,
        String projectPath,
        Map<String, Object> config,
        List<Object> activeAgents,
        Map<String, Object> sharedState
) implements LevelData {

    @Override
    public ContextLevel level() {
        return ContextLevel.PROJECT;
    }

    public static ProjectData from(Map<String, Object> payload) {
        return new ProjectData(
                LevelData.requiredString(payload, "projectName", ContextLevel.PROJECT),
                LevelData.optionalString(payload, "projectPath"),
                LevelData.optionalObject(payload, "config"),
                LevelData.optionalList(payload, "activeAgents"),
                LevelData.optionalObject(payload, "sharedState"));
    }
}
