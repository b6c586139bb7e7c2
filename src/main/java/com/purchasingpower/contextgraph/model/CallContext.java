package com.purchasingpower.contextgraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One logged call to a collaborator outside the in-memory graph.
 *
 * <p>Request and response lines share a short call id and the response line
 * carries the elapsed time. Quiet calls log their request/response lines at
 * DEBUG; errors are always logged at ERROR.
 *
 * @see com.purchasingpower.contextgraph.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;
    private final boolean quiet;

    public CallContext(ServiceType service, String operation, Logger logger, boolean quiet) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
        this.quiet = quiet;
    }

    public void logRequest(String summary, Object... details) {
        line("{} {} → {} [{}] {}", service.getEmoji(), service.getName(), operation, callId, orEmpty(summary));
        details(details);
    }

    public void logResponse(String summary, Object... details) {
        line("{} {} ← {} [{}] ({}ms) {}", service.getEmoji(), service.getName(), operation, callId,
                getElapsedMs(), orEmpty(summary));
        details(details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void line(String format, Object... args) {
        if (quiet) {
            logger.debug(format, args);
        } else {
            logger.info(format, args);
        }
    }

    // key/value pairs
    private void details(Object... details) {
        if (details == null) {
            return;
        }
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    private static String orEmpty(String summary) {
        return summary == null ? "" : summary;
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
