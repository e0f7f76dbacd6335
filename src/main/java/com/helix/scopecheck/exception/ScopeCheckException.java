package com.helix.scopecheck.exception;

import lombok.Getter;

@Getter
public abstract class ScopeCheckException extends RuntimeException {

    private final ErrorCategory category;

    protected ScopeCheckException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected ScopeCheckException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
