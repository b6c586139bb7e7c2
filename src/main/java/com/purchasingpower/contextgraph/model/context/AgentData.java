package com.purchasingpower.contextgraph.model.context;

import java.util.List;
import java.util.Map;

/**
 * Agent-level payload.
 *
 * @param agentId      Agent identifier
 * @param agentType    Persona or role name
 * @param state        Free-form working state
 * @param history      Chronological entries, oldest first
 * @param capabilities Capability names, kept verbatim
 */
public record AgentData(
        String agentId,
        String agentType,
        Map<String, Object> state,
        List<Object> history,
        List<Object> capabilities
) implements LevelData {

    @Override
    public ContextLevel level() {
        return ContextLevel.AGENT;
    }

    public static AgentData from(Map<String, Object> payload) {
        return new AgentData(
                LevelData.requiredString(payload, "agentId", ContextLevel.AGENT),
                LevelData.requiredString(payload, "agentType", ContextLevel.AGENT),
                LevelData.optionalObject(payload, "state"),
                LevelData.optionalList(payload, "history"),
                LevelData.optionalList(payload, "capabilities"));
    }
}
