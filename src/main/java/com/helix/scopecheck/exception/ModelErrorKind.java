package com.helix.scopecheck.exception;

/**
 * Failure reported by the model invocation service.
 */
public enum ModelErrorKind {
    TIMEOUT(true),
    QUOTA_EXCEEDED(false),
    INVALID_CREDENTIALS(false),
    UNKNOWN(true);

    private final boolean recoverable;

    ModelErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
