package com.helix.scopecheck.exception;

public class RepoUnavailableException extends InputException {

    public RepoUnavailableException(String message) {
        super(message);
    }

    public RepoUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
