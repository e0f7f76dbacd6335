package com.helix.scopecheck.model.verdict;

import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Validated judgment of one change.
 *
 * @param alignmentScore in [0.0, 1.0]
 * @param approvalRequired as returned by the judge; {@code ScoreAggregator} decides the final value
 */
public record AlignmentVerdict(double alignmentScore,
                               List<Violation> violations,
                               String summary,
                               boolean approvalRequired) {

    public AlignmentVerdict {
        Preconditions.checkArgument(alignmentScore >= 0.0 && alignmentScore <= 1.0,
                "alignment score %s outside [0, 1]", alignmentScore);
        violations = violations == null ? List.of() : List.copyOf(violations);
        summary = summary == null ? "" : summary.strip();
    }

    public boolean hasCritical() {
        return violations.stream().anyMatch(Violation::isCritical);
    }

    public AlignmentVerdict withSummary(String newSummary) {
        return new AlignmentVerdict(alignmentScore, violations, newSummary, approvalRequired);
    }

    public AlignmentVerdict withApproval(List<Violation> orderedViolations, boolean required) {
        return new AlignmentVerdict(alignmentScore, orderedViolations, summary, required);
    }
}
