package com.helix.scopecheck.exception;

import lombok.Getter;

@Getter
public class ModelInvocationException extends RuntimeException {

    private final ModelErrorKind kind;

    public ModelInvocationException(ModelErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelInvocationException(ModelErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
