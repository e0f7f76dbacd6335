package com.helix.scopecheck.util;

import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import org.slf4j.Logger;

/**
 * Entry point for structured logging of calls to git hosts, document stores and the model service.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Shortens large payloads (prompts, raw model output) for log lines.
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
}
