package com.helix.scopecheck.model;

import com.helix.scopecheck.exception.ScopeCheckCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag of one check, polled between pipeline steps and judge states.
 */
public class CancellationToken {

    private final String checkId;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public CancellationToken(String checkId) {
        this.checkId = checkId;
    }

    public static CancellationToken none() {
        return new CancellationToken("-");
    }

    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ScopeCheckCancelledException(checkId);
        }
    }

    public String getCheckId() {
        return checkId;
    }
}
