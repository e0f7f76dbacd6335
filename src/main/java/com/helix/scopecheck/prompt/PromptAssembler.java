package com.helix.scopecheck.prompt;

import com.helix.scopecheck.budget.Budget;
import com.helix.scopecheck.budget.ModelProfile;
import com.helix.scopecheck.budget.PromptSections;
import com.helix.scopecheck.budget.RankedFit;
import com.helix.scopecheck.budget.SectionPriority;
import com.helix.scopecheck.budget.SectionRequest;
import com.helix.scopecheck.budget.TokenBudgetManager;
import com.helix.scopecheck.budget.TokenEstimator;
import com.helix.scopecheck.configuration.AlignmentProperties;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.model.change.RepositoryMap;
import com.helix.scopecheck.model.prompt.AssembledPrompt;
import com.helix.scopecheck.model.retrieval.EvidenceChunk;
import com.helix.scopecheck.model.retrieval.RetrievalResult;
import com.helix.scopecheck.model.summary.DiffSummary;
import com.helix.scopecheck.model.summary.HunkExcerpt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the judge prompt from the diff summary and the retrieved evidence.
 *
 * <p>Pure and deterministic: identical inputs give an identical payload. Sections always appear
 * in the order instructions, schema, diff summary, evidence, few-shot examples. The repository
 * map has its own reservation but is printed at the end of the diff summary block.
 */
@Slf4j
@Component
public class PromptAssembler {

    public static final String STANDARD_TEMPLATE = "scope-check";
    public static final String SMALL_MODEL_TEMPLATE = "scope-check-slm";
    public static final String REPAIR_TEMPLATE = "scope-check-repair";

    static final String NO_EVIDENCE = "No approved design documents were found for this project.";
    static final String FEW_SHOT_HEADER = "### EXAMPLES";

    private static final String SECTION_SEPARATOR = "\n\n";
    private static final int SEPARATOR_TOKENS = 4;
    private static final Pattern BLANK_LINE = Pattern.compile("\n\\s*\n");

    private final PromptLibraryService promptLibrary;
    private final VerdictSchema verdictSchema;
    private final AlignmentProperties alignment;

    public PromptAssembler(PromptLibraryService promptLibrary, VerdictSchema verdictSchema, AppProperties properties) {
        this.promptLibrary = promptLibrary;
        this.verdictSchema = verdictSchema;
        this.alignment = properties.getAlignment();
    }

    /**
     * Sizes every section for {@link TokenBudgetManager#allocate}.
     */
    public List<SectionRequest> describeSections(DiffSummary summary,
                                                 RetrievalResult evidence,
                                                 RepositoryMap repoMap,
                                                 ModelProfile profile) {
        String template = templateFor(profile);
        String diffHeader = diffHeader(summary);
        String evidenceHeader = evidenceHeader(evidence);

        List<SectionRequest> sections = new ArrayList<>();
        sections.add(SectionRequest.fixed(PromptSections.SYSTEM_INSTRUCTIONS,
                TokenEstimator.estimate(instructions(template)) + SEPARATOR_TOKENS));
        sections.add(SectionRequest.fixed(PromptSections.OUTPUT_SCHEMA,
                TokenEstimator.estimate(schemaSection())));
        sections.add(SectionRequest.withFloor(PromptSections.DIFF_SUMMARY, SectionPriority.HIGH,
                TokenEstimator.estimate(join(diffHeader, summary.excerpts().stream().map(HunkExcerpt::render).toList())),
                TokenEstimator.estimate(diffHeader)));
        if (!repoMap.isEmpty()) {
            sections.add(SectionRequest.weighted(PromptSections.REPO_MAP, SectionPriority.LOW,
                    TokenEstimator.estimate(join(repoMapHeader(repoMap), repoMap.paths().stream().map(PromptAssembler::renderPath).toList()))));
        }
        sections.add(SectionRequest.withFloor(PromptSections.RETRIEVED_CONTEXT, SectionPriority.MEDIUM,
                TokenEstimator.estimate(join(evidenceHeader, evidence.chunks().stream().map(PromptAssembler::renderChunk).toList())),
                TokenEstimator.estimate(evidenceHeader)));
        sections.add(SectionRequest.weighted(PromptSections.FEW_SHOT_EXAMPLES, SectionPriority.LOW,
                TokenEstimator.estimate(fewShot(template))));
        if (alignment.getMaxRetries() > 0) {
            sections.add(SectionRequest.fixed(PromptSections.REPAIR_RESERVE, repairReserveTokens()));
        }
        return sections;
    }

    /**
     * Fits every section into its reservation and joins them in the fixed order.
     */
    public AssembledPrompt assemble(DiffSummary summary,
                                    RetrievalResult evidence,
                                    RepositoryMap repoMap,
                                    Budget budget,
                                    TokenBudgetManager budgetManager) {
        ModelProfile profile = budgetManager.profile();
        String template = templateFor(profile);
        Map<String, String> rendered = new LinkedHashMap<>();

        rendered.put(PromptSections.SYSTEM_INSTRUCTIONS,
                budgetManager.fitSection(budget, PromptSections.SYSTEM_INSTRUCTIONS, instructions(template)));
        rendered.put(PromptSections.OUTPUT_SCHEMA,
                budgetManager.fitSection(budget, PromptSections.OUTPUT_SCHEMA, schemaSection()));

        RankedFit<HunkExcerpt> diff = budgetManager.fitRanked(budget, PromptSections.DIFF_SUMMARY,
                diffHeader(summary), summary.excerpts(), HunkExcerpt::render,
                (excerpt, room) -> excerpt.withText(TokenBudgetManager.truncate(excerpt.text(),
                        room - TokenEstimator.estimate(excerpt.withText("").render()) - 1)));
        rendered.put(PromptSections.DIFF_SUMMARY, diff.text() + fitRepoMap(repoMap, budget, budgetManager));

        RankedFit<EvidenceChunk> context = budgetManager.fitRanked(budget, PromptSections.RETRIEVED_CONTEXT,
                evidenceHeader(evidence), evidence.chunks(), PromptAssembler::renderChunk,
                (chunk, room) -> withText(chunk, TokenBudgetManager.truncate(chunk.text(),
                        room - TokenEstimator.estimate(renderChunk(withText(chunk, ""))) - 1)));
        rendered.put(PromptSections.RETRIEVED_CONTEXT, context.text());

        if (budget.fewShotEnabled()
                && budget.reserved(PromptSections.FEW_SHOT_EXAMPLES) > TokenEstimator.estimate(FEW_SHOT_HEADER)) {
            // examples are kept or dropped whole, never cut
            RankedFit<String> examples = budgetManager.fitRanked(budget, PromptSections.FEW_SHOT_EXAMPLES,
                    FEW_SHOT_HEADER, fewShotExamples(template), Function.identity(), null);
            if (!examples.kept().isEmpty()) {
                rendered.put(PromptSections.FEW_SHOT_EXAMPLES, examples.text());
            }
        }

        Map<String, Integer> tokens = new LinkedHashMap<>();
        rendered.forEach((section, text) -> tokens.put(section, TokenEstimator.estimate(text)));
        String text = String.join(SECTION_SEPARATOR, rendered.values());

        if (context.dropped() > 0 || diff.dropped() > 0) {
            log.info("Prompt trimmed to budget: dropped {} evidence chunk(s), {} hunk excerpt(s)",
                    context.dropped(), diff.dropped());
        }
        log.debug("Assembled prompt: template={}, ~{} tokens, decoding={}",
                template, TokenEstimator.estimate(text), budget.decodingMode());

        return new AssembledPrompt(text, budget.decodingMode(), template, List.copyOf(rendered.keySet()), tokens,
                context.dropped(), budget.reserved(PromptSections.REPAIR_RESERVE));
    }

    /**
     * Appends the correction instruction for a repair attempt to the original prompt. The echoed
     * output is cut to {@code app.alignment.repair-echo-chars} and the whole instruction to the
     * repair reservation.
     */
    public String assembleRepair(AssembledPrompt prompt, String previousOutput, List<String> problems) {
        String echo = previousOutput == null ? "" : previousOutput.strip();
        if (echo.length() > alignment.getRepairEchoChars()) {
            echo = echo.substring(0, alignment.getRepairEchoChars()) + "...";
        }
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("previousOutput", echo.isEmpty() ? "(empty response)" : echo);
        vars.put("problems", problems.stream().map(p -> "- " + p).collect(Collectors.joining("\n")));
        String repair = promptLibrary.renderUser(REPAIR_TEMPLATE, vars);
        int limit = prompt.repairTokens() > 0 ? prompt.repairTokens() : repairReserveTokens();
        return prompt.text() + SECTION_SEPARATOR + TokenBudgetManager.truncate(repair, limit - SEPARATOR_TOKENS);
    }

    static String renderChunk(EvidenceChunk chunk) {
        return String.format(Locale.ROOT, "[doc: %s] (relevance %.2f)\n%s",
                chunk.sourceDocId(), chunk.combinedScore(), chunk.text());
    }

    private String templateFor(ModelProfile profile) {
        return profile.smallModel() ? SMALL_MODEL_TEMPLATE : STANDARD_TEMPLATE;
    }

    private String instructions(String template) {
        Map<String, Object> vars = Map.of(
                "approvalThreshold", String.format(Locale.ROOT, "%.2f", alignment.getApprovalThreshold()));
        return "### INSTRUCTIONS\n" + promptLibrary.renderSystem(template, vars);
    }

    private String schemaSection() {
        return "### OUTPUT SCHEMA\nRespond with one JSON object that validates against this JSON Schema:\n"
                + verdictSchema.json();
    }

    private String fewShot(String template) {
        List<String> examples = fewShotExamples(template);
        return examples.isEmpty() ? "" : join(FEW_SHOT_HEADER, examples);
    }

    private List<String> fewShotExamples(String template) {
        String examples = promptLibrary.renderFewShot(template, Map.of()).strip();
        if (examples.isEmpty()) {
            return List.of();
        }
        List<String> split = new ArrayList<>();
        for (String example : BLANK_LINE.split(examples)) {
            if (!example.isBlank()) {
                split.add(example.strip());
            }
        }
        return split;
    }

    /**
     * Whole path lines only. The blank line separating the map from the excerpts is part of the
     * map's header and counted against its reservation.
     */
    private String fitRepoMap(RepositoryMap repoMap, Budget budget, TokenBudgetManager budgetManager) {
        if (repoMap.isEmpty()) {
            return "";
        }
        String header = repoMapHeader(repoMap);
        if (budget.reserved(PromptSections.REPO_MAP) <= TokenEstimator.estimate(header)) {
            return "";
        }
        RankedFit<String> fit = budgetManager.fitRanked(budget, PromptSections.REPO_MAP, header,
                repoMap.paths(), PromptAssembler::renderPath, null);
        if (fit.kept().isEmpty()) {
            return "";
        }
        if (fit.dropped() > 0) {
            log.debug("Repository map trimmed to {} of {} listed paths", fit.kept().size(), repoMap.paths().size());
        }
        return fit.text();
    }

    private static String repoMapHeader(RepositoryMap repoMap) {
        return "\n\n#### REPOSITORY MAP (" + repoMap.totalFiles() + " files)";
    }

    private static String renderPath(String path) {
        return "- " + path;
    }

    private static String diffHeader(DiffSummary summary) {
        return "### DIFF SUMMARY\n" + summary.renderHeader();
    }

    private static String evidenceHeader(RetrievalResult evidence) {
        StringBuilder sb = new StringBuilder("### APPROVED DESIGN EVIDENCE");
        if (evidence.isDegraded()) {
            String sources = evidence.degradedSources().stream()
                    .sorted()
                    .map(s -> s.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", "));
            sb.append("\nNote: the ").append(sources)
                    .append(" retrieval source(s) were unavailable; evidence may be incomplete.");
        }
        if (evidence.isEmpty()) {
            sb.append('\n').append(NO_EVIDENCE);
        }
        return sb.toString();
    }

    private int repairReserveTokens() {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("previousOutput", "x".repeat(alignment.getRepairEchoChars() + 3));
        vars.put("problems", "");
        // problem lines vary per attempt; a flat allowance covers a handful of them
        return TokenEstimator.estimate(promptLibrary.renderUser(REPAIR_TEMPLATE, vars)) + 200 + SEPARATOR_TOKENS;
    }

    private static EvidenceChunk withText(EvidenceChunk chunk, String text) {
        return new EvidenceChunk(chunk.sourceDocId(), text, chunk.vectorScore(), chunk.graphDistance(),
                chunk.relationalRank(), chunk.combinedScore());
    }

    private static String join(String header, List<String> items) {
        if (items.isEmpty()) {
            return header;
        }
        return header + "\n" + String.join("\n", items);
    }
}
