package com.helix.scopecheck.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.helix.scopecheck.model.retrieval.RetrievalSource;
import com.helix.scopecheck.model.verdict.ScopeCheckResult;
import com.helix.scopecheck.model.verdict.Violation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * Response DTO of a scope check. On failure only {@code success}, {@code errorCategory} and
 * {@code error} are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScopeCheckResponse {

    private boolean success;
    private String checkId;
    private Double alignmentScore;
    private Boolean approvalRequired;
    private List<ViolationView> violations;
    private String summary;
    private String report;
    private Boolean lowConfidence;
    private List<String> degradedSources;
    private Integer attempts;
    private Integer repairCycles;
    private String errorCategory;
    private String error;

    public static ScopeCheckResponse from(ScopeCheckResult result) {
        return ScopeCheckResponse.builder()
                .success(true)
                .checkId(result.checkId())
                .alignmentScore(result.verdict().alignmentScore())
                .approvalRequired(result.verdict().approvalRequired())
                .violations(result.verdict().violations().stream().map(ViolationView::of).toList())
                .summary(result.verdict().summary())
                .report(result.report())
                .lowConfidence(result.lowConfidence())
                .degradedSources(result.degradedSources().stream()
                        .sorted()
                        .map(ScopeCheckResponse::sourceName)
                        .toList())
                .attempts(result.attempts())
                .repairCycles(result.repairCycles())
                .build();
    }

    public static ScopeCheckResponse error(String category, String message) {
        return ScopeCheckResponse.builder()
                .success(false)
                .errorCategory(category)
                .error(message)
                .build();
    }

    /**
     * Violation with wire names, as the judge's schema spells them.
     */
    public record ViolationView(String kind, String severity, String filePath,
                                String description, String recommendation) {

        static ViolationView of(Violation v) {
            return new ViolationView(v.kind().wireName(), v.severity().wireName(), v.filePath(),
                    v.description(), v.recommendation());
        }
    }

    private static String sourceName(RetrievalSource source) {
        return source.name().toLowerCase(Locale.ROOT);
    }
}
