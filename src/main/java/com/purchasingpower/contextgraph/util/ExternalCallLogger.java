package com.purchasingpower.contextgraph.util;

import com.purchasingpower.contextgraph.model.CallContext;
import com.purchasingpower.contextgraph.model.ServiceType;
import org.slf4j.Logger;

import java.util.Map;

/**
 * Structured logging for calls that leave the in-memory graph (Neo4j, the
 * compression worker pool).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger, false);
    }

    /**
     * Same as {@link #startCall} with request/response lines at DEBUG, for
     * high-volume calls such as per-mutation mirroring.
     */
    public static CallContext startQuietCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger, true);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    public static String formatMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        if (map.size() <= 5) {
            return map.toString();
        }
        return "{" + map.size() + " entries}";
    }
}
