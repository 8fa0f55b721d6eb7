package com.purchasingpower.codegraph.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call into a collaborator (entity store, file system, parser).
 *
 * Each call gets a short id and a start instant so that the request,
 * response, recovery and error lines of the same call can be correlated
 * in the log and carry the elapsed time.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {} → {} [{}]",
                service.getEmoji(),
                service.getName(),
                operation,
                callId);
        logDetails("Request", summary, details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs());
        logDetails("Response", summary, details);
    }

    /**
     * Logs a call that hit an expected conflict and was answered from a
     * fallback path instead of failing.
     */
    public void logRecovered(String reason, Object... details) {
        logger.warn("{} {} ↺ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                reason);
        logDetails("Recovery", null, details);
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

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }

    private void logDetails(String label, String summary, Object... details) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  {}: {}", label, summary);
        }
        if (details != null) {
            for (int i = 0; i + 1 < details.length; i += 2) {
                logger.debug("  {}: {}", details[i], details[i + 1]);
            }
        }
    }
}
