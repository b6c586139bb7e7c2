package com.purchasingpower.contextgraph.model.context;

import java.util.List;
import java.util.Map;

/**
 * Global payload. Validated but never summarized.
 */
public record GlobalData(
        Map<String, Object> systemConfig,
        List<Object> activeProjects,
        Map<String, Object> globalState
) implements LevelData {

    @Override
    public ContextLevel level() {
        return ContextLevel.GLOBAL;
    }

    public static GlobalData from(Map<String, Object> payload) {
        return new GlobalData(
                LevelData.optionalObject(payload, "systemConfig"),
                LevelData.optionalList(payload, "activeProjects"),
                LevelData.optionalObject(payload, "globalState"));
    }
}
