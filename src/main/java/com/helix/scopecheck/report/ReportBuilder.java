package com.helix.scopecheck.report;

import com.helix.scopecheck.model.retrieval.RetrievalSource;
import com.helix.scopecheck.model.verdict.AlignmentVerdict;
import com.helix.scopecheck.model.verdict.Violation;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders the markdown report of an aggregated verdict. Identical input gives identical bytes.
 */
@Component
public class ReportBuilder {

    static final String PROJECT_WIDE = "project-wide";

    public String render(AlignmentVerdict verdict, Set<RetrievalSource> degradedSources) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Scope Check Report\n");
        sb.append("**Alignment Score:** ").append(String.format(Locale.ROOT, "%.2f", verdict.alignmentScore())).append('\n');
        sb.append("### Violations Found\n");
        if (verdict.violations().isEmpty()) {
            sb.append("- None\n");
        }
        for (Violation v : verdict.violations()) {
            sb.append("- [").append(v.severity().name()).append("] **").append(v.kind().wireName()).append("** in `")
                    .append(v.filePath() == null ? PROJECT_WIDE : v.filePath()).append("`: ")
                    .append(singleLine(v.description())).append('\n');
            if (!v.recommendation().isEmpty()) {
                sb.append("  - **Recommendation:** ").append(singleLine(v.recommendation())).append('\n');
            }
        }
        sb.append("**Approval required:** ").append(verdict.approvalRequired()).append('\n');
        sb.append("**Summary:** ").append(singleLine(verdict.summary()));
        if (!degradedSources.isEmpty()) {
            String sources = degradedSources.stream()
                    .sorted()
                    .map(s -> s.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            sb.append("\n**Confidence:** low (retrieval sources unavailable: ").append(sources).append(')');
        }
        return sb.toString();
    }

    private static String singleLine(String text) {
        return text.replaceAll("\\s*\\R\\s*", " ").strip();
    }
}
