package com.purchasingpower.contextgraph.model.context;

import com.purchasingpower.contextgraph.exception.ContextValidationException;

import java.util.List;
import java.util.Map;

/**
 * Strongly typed view of a level-specific payload.
 *
 * <p>Implementations are records; {@link #parse(ContextLevel, Map)} validates the
 * raw payload against the shape of its level.
 */
public interface LevelData {

    ContextLevel level();

    /**
     * @throws ContextValidationException when the payload does not match the level's shape
     */
    static LevelData parse(ContextLevel level, Map<String, Object> payload) {
        return switch (level) {
            case AGENT -> AgentData.from(payload);
            case TASK -> TaskData.from(payload);
            case PROJECT -> ProjectData.from(payload);
            case GLOBAL -> GlobalData.from(payload);
        };
    }

    // ================================================================
    // FIELD READERS
    // ================================================================

    static String requiredString(Map<String, Object> payload, String field, ContextLevel level) {
        Object value = payload.get(field);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ContextValidationException(field,
                    level.name().toLowerCase() + " context requires a non-blank '" + field + "'");
        }
        return text;
    }

    static String optionalString(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ContextValidationException(field, "'" + field + "' must be a string");
        }
        return text;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> optionalObject(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ContextValidationException(field, "'" + field + "' must be an object");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static List<Object> optionalList(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new ContextValidationException(field, "'" + field + "' must be an array");
        }
        return (List<Object>) value;
    }
}
