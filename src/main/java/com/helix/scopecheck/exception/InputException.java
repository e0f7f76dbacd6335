package com.helix.scopecheck.exception;

public class InputException extends ScopeCheckException {

    public InputException(String message) {
        super(ErrorCategory.INPUT_ERROR, message);
    }

    public InputException(String message, Throwable cause) {
        super(ErrorCategory.INPUT_ERROR, message, cause);
    }
}
