package com.helix.scopecheck.report;

import com.helix.scopecheck.model.verdict.ScopeCheckResult;

/**
 * Records the outcome of a check. Called once per check, on its terminal state.
 */
public interface ReportPublisher {

    void publish(ScopeCheckResult result);

    void publishFailure(String checkId, String projectId, String reason);
}
