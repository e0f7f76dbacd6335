package com.helix.scopecheck.service;

import com.helix.scopecheck.model.CancellationToken;
import com.helix.scopecheck.model.verdict.ScopeCheckResult;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted check. The future completes with the result, or exceptionally with the
 * failure that ended the check ({@code ScopeCheckCancelledException} after {@link #cancel()}).
 */
public class ScopeCheckHandle {

    private final CompletableFuture<ScopeCheckResult> result;
    private final CancellationToken cancellation;

    ScopeCheckHandle(CompletableFuture<ScopeCheckResult> result, CancellationToken cancellation) {
        this.result = result;
        this.cancellation = cancellation;
    }

    public String getCheckId() {
        return cancellation.getCheckId();
    }

    public CompletableFuture<ScopeCheckResult> getResult() {
        return result;
    }

    /**
     * Requests cancellation. The check stops at its next state boundary; a check that already
     * reached a terminal state is unaffected.
     *
     * @return {@code false} if cancellation was already requested
     */
    public boolean cancel() {
        return cancellation.cancel();
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
