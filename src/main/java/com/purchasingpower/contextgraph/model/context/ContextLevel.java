package com.purchasingpower.contextgraph.model.context;

import com.purchasingpower.contextgraph.exception.ContextValidationException;

import java.util.Locale;

/**
 * Scope of a context record. Type-specific summarization dispatches on it.
 */
public enum ContextLevel {
    /** System-wide state, never compressed by ratio summarization */
    GLOBAL,

    /** One project and its shared state */
    PROJECT,

    /** One agent: state, history, capabilities */
    AGENT,

    /** One unit of work */
    TASK;

    /**
     * Parse a level name case-insensitively.
     *
     * @return The level, or {@code null} for a blank name (generic record)
     * @throws ContextValidationException for an unknown name
     */
    public static ContextLevel fromName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ContextValidationException("level", "Unknown context level: " + name);
        }
    }
}
