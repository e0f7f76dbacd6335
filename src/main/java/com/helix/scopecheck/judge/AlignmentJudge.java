package com.helix.scopecheck.judge;

import com.helix.scopecheck.client.ModelInvoker;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.exception.AnalysisUnavailableException;
import com.helix.scopecheck.exception.MalformedModelOutputException;
import com.helix.scopecheck.exception.ModelInvocationException;
import com.helix.scopecheck.model.verdict.AlignmentVerdict;
import com.helix.scopecheck.prompt.PromptAssembler;
import com.helix.scopecheck.prompt.VerdictSchema;
import com.helix.scopecheck.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs the judge state machine for one check.
 *
 * <pre>
 * BUILDING -> INVOKING -> VALIDATING -> ACCEPTED
 *                 ^            |
 *                 |            +-> REPAIRING --+
 *                 +----------------------------+
 *                              |
 *                              +-> FAILED
 * </pre>
 *
 * At most {@code max-retries + 1} invocations are made, strictly one at a time. Malformed output
 * is retried with a correction instruction; recoverable service errors (timeout, unknown) are
 * retried with the unchanged prompt; quota and credential errors fail at once.
 */
@Slf4j
@Service
public class AlignmentJudge {

    static final String NO_DESIGN_NOTE = "No approved design found for this project.";

    private final ModelInvoker modelInvoker;
    private final VerdictParser verdictParser;
    private final PromptAssembler promptAssembler;
    private final VerdictSchema verdictSchema;
    private final int maxRetries;

    public AlignmentJudge(ModelInvoker modelInvoker,
                          VerdictParser verdictParser,
                          PromptAssembler promptAssembler,
                          VerdictSchema verdictSchema,
                          AppProperties properties) {
        this.modelInvoker = modelInvoker;
        this.verdictParser = verdictParser;
        this.promptAssembler = promptAssembler;
        this.verdictSchema = verdictSchema;
        this.maxRetries = properties.getAlignment().getMaxRetries();
    }

    /**
     * @throws AnalysisUnavailableException when the machine ends in FAILED
     * @throws com.helix.scopecheck.exception.ScopeCheckCancelledException when cancelled before a terminal state
     */
    public JudgeOutcome judge(JudgeRequest request) {
        Run run = new Run(request);
        run.enter(JudgeState.BUILDING, "model=" + modelInvoker.describe());

        String prompt = request.prompt().text();
        int maxAttempts = maxRetries + 1;

        while (true) {
            request.cancellation().throwIfCancelled();
            run.attempts++;
            run.enter(JudgeState.INVOKING, "attempt " + run.attempts + "/" + maxAttempts);

            String raw;
            try {
                raw = modelInvoker.invoke(prompt, verdictSchema.json(), request.prompt().decodingMode());
            } catch (ModelInvocationException e) {
                run.enter(JudgeState.VALIDATING, "service error " + e.getKind());
                if (!e.getKind().isRecoverable()) {
                    throw run.fail("Model service error " + e.getKind() + ": " + e.getMessage(), e);
                }
                if (run.attempts >= maxAttempts) {
                    throw run.fail("Model service kept failing (" + e.getKind() + ") after " + run.attempts + " attempts", e);
                }
                log.warn("Recoverable model service error {} on attempt {}: {}", e.getKind(), run.attempts, e.getMessage());
                run.repairCycles++;
                run.enter(JudgeState.REPAIRING, "re-invoking unchanged prompt after " + e.getKind());
                continue;
            }

            request.cancellation().throwIfCancelled();
            run.enter(JudgeState.VALIDATING, raw == null ? "no output" : raw.length() + " chars");
            try {
                AlignmentVerdict verdict = verdictParser.parse(raw, request.fileInventory());
                if (request.noEvidence()) {
                    verdict = noteMissingDesign(verdict);
                }
                run.enter(JudgeState.ACCEPTED, String.format(Locale.ROOT, "score=%.2f, violations=%d",
                        verdict.alignmentScore(), verdict.violations().size()));
                return new JudgeOutcome(verdict, run.attempts, run.repairCycles, run.trace);
            } catch (MalformedModelOutputException e) {
                log.warn("Model output rejected on attempt {}: {}", run.attempts, e.getProblems());
                log.debug("Rejected output: {}", ExternalCallLogger.truncate(raw, 500));
                if (run.attempts >= maxAttempts) {
                    throw run.fail("Model output still invalid after " + run.attempts + " attempts: "
                            + String.join("; ", e.getProblems()), e);
                }
                run.repairCycles++;
                run.enter(JudgeState.REPAIRING, e.getProblems().size() + " problem(s)");
                prompt = promptAssembler.assembleRepair(request.prompt(), raw, e.getProblems());
            }
        }
    }

    private static AlignmentVerdict noteMissingDesign(AlignmentVerdict verdict) {
        String summary = verdict.summary();
        if (summary.toLowerCase(Locale.ROOT).contains("no approved design")) {
            return verdict;
        }
        return verdict.withSummary(summary.isEmpty() ? NO_DESIGN_NOTE : NO_DESIGN_NOTE + " " + summary);
    }

    /**
     * Mutable bookkeeping of one judge run.
     */
    private static final class Run {
        private final JudgeRequest request;
        private final List<JudgeState> trace = new ArrayList<>();
        private int attempts;
        private int repairCycles;

        Run(JudgeRequest request) {
            this.request = request;
        }

        void enter(JudgeState next, String detail) {
            JudgeState previous = trace.isEmpty() ? null : trace.get(trace.size() - 1);
            trace.add(next);
            if (previous == null) {
                log.info("[judge {}] -> {} ({})", request.cancellation().getCheckId(), next, detail);
            } else {
                log.info("[judge {}] {} -> {} ({})", request.cancellation().getCheckId(), previous, next, detail);
            }
        }

        AnalysisUnavailableException fail(String reason, Throwable cause) {
            enter(JudgeState.FAILED, reason);
            log.error("[judge {}] analysis unavailable: {}", request.cancellation().getCheckId(), reason);
            return new AnalysisUnavailableException(reason, attempts, cause);
        }
    }
}
