package com.helix.scopecheck.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One logged call to an external collaborator: request line, response line with elapsed time,
 * or an error line. Detail pairs ({@code key, value, key, value...}) are logged at DEBUG.
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
        logger.info("{} {} → {} [{}]", service.getEmoji(), service.getDisplayName(), operation, callId);
        logDetails("Request", summary, details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(), service.getDisplayName(), operation, callId, getElapsedMs());
        logDetails("Response", summary, details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getDisplayName(), operation, callId, getElapsedMs(), errorMessage);
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
