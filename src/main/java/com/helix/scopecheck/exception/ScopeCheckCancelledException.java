package com.helix.scopecheck.exception;

import java.util.concurrent.CancellationException;

public class ScopeCheckCancelledException extends CancellationException {

    public ScopeCheckCancelledException(String checkId) {
        super("Scope check " + checkId + " was cancelled");
    }
}
