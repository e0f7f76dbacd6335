package com.helix.scopecheck.report;

import com.helix.scopecheck.model.verdict.ScopeCheckResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Slf4j
@Component
public class LoggingReportPublisher implements ReportPublisher {

    @Override
    public void publish(ScopeCheckResult result) {
        log.info("Scope check {} for project '{}': score={}, violations={}, approvalRequired={}{}\n{}",
                result.checkId(), result.projectId(),
                String.format(Locale.ROOT, "%.2f", result.verdict().alignmentScore()),
                result.verdict().violations().size(),
                result.verdict().approvalRequired(),
                result.lowConfidence() ? " (low confidence)" : "",
                result.report());
    }

    @Override
    public void publishFailure(String checkId, String projectId, String reason) {
        log.error("Scope check {} for project '{}' produced no verdict: {}", checkId, projectId, reason);
    }
}
