package com.helix.scopecheck.report;

import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.model.verdict.AlignmentVerdict;
import com.helix.scopecheck.model.verdict.Violation;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Final approval decision and violation order for an accepted verdict.
 *
 * <p>Approval is required when any violation is critical or the score is below the threshold,
 * whatever the model itself answered.
 */
@Component
public class ScoreAggregator {

    static final Comparator<Violation> REPORT_ORDER = Comparator
            .comparing(Violation::severity)
            .thenComparing(Violation::filePath, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(v -> v.kind().wireName())
            .thenComparing(Violation::description);

    private final double approvalThreshold;

    public ScoreAggregator(AppProperties properties) {
        this(properties.getAlignment().getApprovalThreshold());
    }

    public ScoreAggregator(double approvalThreshold) {
        this.approvalThreshold = approvalThreshold;
    }

    public AlignmentVerdict aggregate(AlignmentVerdict verdict) {
        List<Violation> ordered = verdict.violations().stream().sorted(REPORT_ORDER).toList();
        boolean approvalRequired = verdict.hasCritical() || verdict.alignmentScore() < approvalThreshold;
        return verdict.withApproval(ordered, approvalRequired);
    }

    public double getApprovalThreshold() {
        return approvalThreshold;
    }
}
