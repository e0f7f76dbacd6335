package com.helix.scopecheck.model.verdict;

import com.helix.scopecheck.model.retrieval.RetrievalSource;

import java.util.Set;

/**
 * Terminal artifact of a successful check: the final verdict and its rendered report.
 */
public record ScopeCheckResult(String checkId,
                               String projectId,
                               AlignmentVerdict verdict,
                               String report,
                               Set<RetrievalSource> degradedSources,
                               int evidenceCount,
                               int attempts,
                               int repairCycles) {

    public ScopeCheckResult {
        degradedSources = Set.copyOf(degradedSources);
    }

    public boolean lowConfidence() {
        return !degradedSources.isEmpty();
    }
}
