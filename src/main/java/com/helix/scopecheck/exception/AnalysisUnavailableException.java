package com.helix.scopecheck.exception;

import lombok.Getter;

/**
 * The judge reached FAILED. Callers must not substitute a default score.
 */
@Getter
public class AnalysisUnavailableException extends ScopeCheckException {

    private final int attempts;

    public AnalysisUnavailableException(String message, int attempts) {
        super(ErrorCategory.ANALYSIS_UNAVAILABLE, message);
        this.attempts = attempts;
    }

    public AnalysisUnavailableException(String message, int attempts, Throwable cause) {
        super(ErrorCategory.ANALYSIS_UNAVAILABLE, message, cause);
        this.attempts = attempts;
    }
}
