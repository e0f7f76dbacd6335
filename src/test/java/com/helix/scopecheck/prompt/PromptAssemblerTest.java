package com.helix.scopecheck.prompt;

import com.helix.scopecheck.budget.Budget;
import com.helix.scopecheck.budget.DecodingMode;
import com.helix.scopecheck.budget.ModelProfile;
import com.helix.scopecheck.budget.PromptSections;
import com.helix.scopecheck.budget.SectionRequest;
import com.helix.scopecheck.budget.TokenBudgetManager;
import com.helix.scopecheck.budget.TokenEstimator;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.model.change.BranchMetadata;
import com.helix.scopecheck.model.change.ChangeKind;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.Hunk;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.model.change.RepositoryMap;
import com.helix.scopecheck.model.prompt.AssembledPrompt;
import com.helix.scopecheck.model.retrieval.EvidenceChunk;
import com.helix.scopecheck.model.retrieval.RetrievalResult;
import com.helix.scopecheck.model.retrieval.RetrievalSource;
import com.helix.scopecheck.model.summary.DiffSummary;
import com.helix.scopecheck.summary.DiffSummarizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Prompt Assembler Tests")
class PromptAssemblerTest {

    private static final ModelProfile STANDARD = new ModelProfile("standard", 16_000, 2_000, 8, true, false, false);
    private static final ModelProfile SMALL = new ModelProfile("small", 6_144, 2_048, 3, false, true, true);

    private PromptAssembler assembler;
    private DiffSummary summary;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.setWorkspaceDir("/tmp/workspace");
        PromptLibraryService library = new PromptLibraryService();
        library.loadPrompts();
        assembler = new PromptAssembler(library, new VerdictSchema(), properties);

        ChangeSet changeSet = new ChangeSet(new RepoRef("payments"), "main", "feature",
                new BranchMetadata("Add fraud scoring", "Add fraud scoring", 1),
                List.of(FileChange.of("src/payments/fraud.py", ChangeKind.ADDED,
                                List.of(new Hunk(1, 2, "@@ -0,0 +1,2 @@\n+def score(txn):\n+    return 0.5"))),
                        FileChange.of("src/payments/grpc.py", ChangeKind.MODIFIED,
                                List.of(new Hunk(5, 5, "@@ -5 +5 @@\n-PORT = 1\n+PORT = 50051")))));
        summary = new DiffSummarizer(properties).summarize(changeSet, List.of());
    }

    @Test
    @DisplayName("Should lay out sections in the fixed order with the standard template")
    void standardLayout() {
        // Given
        RetrievalResult evidence = new RetrievalResult(List.of(chunk("design-rest", "Payments are REST only.", 0.9)), Set.of());
        TokenBudgetManager manager = TokenBudgetManager.withDefaultWeights(STANDARD);

        // When
        Budget budget = manager.allocate(assembler.describeSections(summary, evidence, RepositoryMap.EMPTY, STANDARD));
        AssembledPrompt prompt = assembler.assemble(summary, evidence, RepositoryMap.EMPTY, budget, manager);

        // Then
        assertThat(prompt.sectionOrder()).containsExactly(PromptSections.SYSTEM_INSTRUCTIONS,
                PromptSections.OUTPUT_SCHEMA, PromptSections.DIFF_SUMMARY, PromptSections.RETRIEVED_CONTEXT,
                PromptSections.FEW_SHOT_EXAMPLES);
        String text = prompt.text();
        assertThat(text.indexOf("### INSTRUCTIONS")).isZero();
        assertThat(text.indexOf("### OUTPUT SCHEMA")).isGreaterThan(0);
        assertThat(text.indexOf("### DIFF SUMMARY")).isGreaterThan(text.indexOf("### OUTPUT SCHEMA"));
        assertThat(text.indexOf("### APPROVED DESIGN EVIDENCE")).isGreaterThan(text.indexOf("### DIFF SUMMARY"));
        assertThat(text.indexOf("### EXAMPLES")).isGreaterThan(text.indexOf("### APPROVED DESIGN EVIDENCE"));

        assertThat(text).contains("Scores below 0.60 require approval.");
        assertThat(text).contains("\"alignment_score\"");
        assertThat(text).contains("- added src/payments/fraud.py (+2/-0)");
        assertThat(text).contains("[doc: design-rest] (relevance 0.90)\nPayments are REST only.");
        assertEquals(PromptAssembler.STANDARD_TEMPLATE, prompt.templateName());
        assertEquals(DecodingMode.FREE_FORM, prompt.decodingMode());
        assertEquals(0, prompt.droppedEvidence());
        assertThat(prompt.repairTokens()).isPositive();
        budget.reserved().keySet().forEach(section ->
                assertThat(budget.used(section)).isLessThanOrEqualTo(budget.reserved(section)));
    }

    @Test
    @DisplayName("Should produce an identical payload for identical inputs")
    void deterministic() {
        RetrievalResult evidence = new RetrievalResult(List.of(
                chunk("design-rest", "Payments are REST only.", 0.9),
                chunk("design-ops", "Deploys go through the release train.", 0.4)), Set.of());

        String first = assemble(evidence, STANDARD).text();
        String second = assemble(evidence, STANDARD).text();

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should use short instructions, constrained decoding and no examples for small models")
    void smallModelLayout() {
        RetrievalResult evidence = new RetrievalResult(List.of(chunk("design-rest", "Payments are REST only.", 0.9)), Set.of());

        AssembledPrompt prompt = assemble(evidence, SMALL);

        assertEquals(PromptAssembler.SMALL_MODEL_TEMPLATE, prompt.templateName());
        assertEquals(DecodingMode.SCHEMA_CONSTRAINED, prompt.decodingMode());
        assertThat(prompt.sectionOrder()).doesNotContain(PromptSections.FEW_SHOT_EXAMPLES);
        assertThat(prompt.text()).doesNotContain("### EXAMPLES").contains("Below 0.60 needs approval.");
    }

    @Test
    @DisplayName("Should drop lowest-ranked evidence when the context is tight")
    void dropsEvidenceToFit() {
        // Given: ten 2000-character chunks do not fit a 6000-token prompt
        List<EvidenceChunk> chunks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            chunks.add(chunk("doc-" + i, ("Design paragraph " + i + ". ").repeat(100).substring(0, 2_000), 1.0 - i * 0.05));
        }
        ModelProfile tight = new ModelProfile("tight", 6_500, 500, 10, false, false, false);

        // When
        AssembledPrompt prompt = assemble(new RetrievalResult(chunks, Set.of()), tight);

        // Then
        assertThat(prompt.droppedEvidence()).isBetween(1, 9);
        assertThat(prompt.text()).contains("[doc: doc-0]").doesNotContain("[doc: doc-9]");
        assertThat(prompt.text()).contains("- modified src/payments/grpc.py");
        assertThat(TokenEstimator.estimate(prompt.text())).isLessThanOrEqualTo(tight.inputTokens());
    }

    @Test
    @DisplayName("Should say so when no design evidence exists or a source was down")
    void noEvidenceAndDegradedNotes() {
        String empty = assemble(new RetrievalResult(List.of(), Set.of()), STANDARD).text();
        String degraded = assemble(new RetrievalResult(
                List.of(chunk("design-rest", "Payments are REST only.", 0.9)), Set.of(RetrievalSource.GRAPH)), STANDARD).text();

        assertThat(empty).contains("### APPROVED DESIGN EVIDENCE\n" + PromptAssembler.NO_EVIDENCE);
        assertThat(degraded).contains("Note: the graph retrieval source(s) were unavailable; evidence may be incomplete.");
    }

    @Test
    @DisplayName("Should print the repository map inside the diff summary block")
    void repositoryMapInDiffSummary() {
        // Given
        RepositoryMap repoMap = new RepositoryMap(
                List.of("README.md", "src/payments/api.py", "src/payments/fraud.py", "src/payments/grpc.py"), 4);
        RetrievalResult evidence = new RetrievalResult(List.of(chunk("design-rest", "Payments are REST only.", 0.9)), Set.of());

        // When
        AssembledPrompt prompt = assemble(evidence, repoMap, STANDARD);

        // Then
        assertThat(prompt.sectionOrder()).containsExactly(PromptSections.SYSTEM_INSTRUCTIONS,
                PromptSections.OUTPUT_SCHEMA, PromptSections.DIFF_SUMMARY, PromptSections.RETRIEVED_CONTEXT,
                PromptSections.FEW_SHOT_EXAMPLES);
        String text = prompt.text();
        int map = text.indexOf("#### REPOSITORY MAP (4 files)\n- README.md\n- src/payments/api.py");
        assertThat(map).isGreaterThan(text.indexOf("- modified src/payments/grpc.py"));
        assertThat(map).isLessThan(text.indexOf("### APPROVED DESIGN EVIDENCE"));
        assertThat(text).contains("- src/payments/grpc.py\n\n### APPROVED DESIGN EVIDENCE");
    }

    @Test
    @DisplayName("Should drop whole repository map lines when the map exceeds its share")
    void trimsRepositoryMapByLine() {
        // Given
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            paths.add(String.format("src/generated/module_%04d/handlers.py", i));
        }
        RepositoryMap repoMap = new RepositoryMap(paths, 2_000);
        ModelProfile tight = new ModelProfile("tight", 6_500, 500, 10, false, false, false);
        TokenBudgetManager manager = TokenBudgetManager.withDefaultWeights(tight);
        RetrievalResult evidence = new RetrievalResult(List.of(), Set.of());

        // When
        Budget budget = manager.allocate(assembler.describeSections(summary, evidence, repoMap, tight));
        AssembledPrompt prompt = assembler.assemble(summary, evidence, repoMap, budget, manager);

        // Then
        String text = prompt.text();
        assertThat(text).contains("#### REPOSITORY MAP (2000 files)\n- src/generated/module_0000/handlers.py\n");
        assertThat(text).doesNotContain("module_1999").doesNotContain("...(truncated)");
        assertThat(budget.used(PromptSections.REPO_MAP)).isLessThanOrEqualTo(budget.reserved(PromptSections.REPO_MAP));
        assertThat(TokenEstimator.estimate(text)).isLessThanOrEqualTo(tight.inputTokens());
    }

    @Test
    @DisplayName("Should keep or drop few-shot examples whole")
    void dropsWholeExamples() {
        // Given: room for the examples header and the first example only
        RetrievalResult evidence = new RetrievalResult(List.of(), Set.of());
        TokenBudgetManager manager = TokenBudgetManager.withDefaultWeights(STANDARD);
        List<SectionRequest> sections = new ArrayList<>();
        for (SectionRequest section : assembler.describeSections(summary, evidence, RepositoryMap.EMPTY, STANDARD)) {
            sections.add(section.name().equals(PromptSections.FEW_SHOT_EXAMPLES)
                    ? SectionRequest.fixed(PromptSections.FEW_SHOT_EXAMPLES, 180)
                    : section);
        }
        Budget budget = manager.allocate(sections);

        // When
        AssembledPrompt prompt = assembler.assemble(summary, evidence, RepositoryMap.EMPTY, budget, manager);

        // Then
        String text = prompt.text();
        assertThat(text).contains("### EXAMPLES\nExample: the approved design describes a REST-only payments API");
        assertThat(text).contains("\"approval_required\": true}");
        assertThat(text).doesNotContain("invoice export").doesNotContain("...(truncated)");
    }

    @Test
    @DisplayName("Should append a bounded correction instruction for repair attempts")
    void repairPrompt() {
        AssembledPrompt prompt = assemble(new RetrievalResult(List.of(), Set.of()), STANDARD);

        String repair = assembler.assembleRepair(prompt, "z".repeat(5_000),
                List.of("alignment_score is required", "violations[0].file_path 'x.py' is not a changed file"));

        assertThat(repair).startsWith(prompt.text());
        String appended = repair.substring(prompt.text().length());
        assertThat(appended).contains("### CORRECTION")
                .contains("- alignment_score is required")
                .contains("- violations[0].file_path 'x.py' is not a changed file")
                .contains("z".repeat(2_000) + "...")
                .doesNotContain("z".repeat(2_001));
        assertThat(TokenEstimator.estimate(appended)).isLessThanOrEqualTo(prompt.repairTokens());
    }

    private AssembledPrompt assemble(RetrievalResult evidence, ModelProfile profile) {
        return assemble(evidence, RepositoryMap.EMPTY, profile);
    }

    private AssembledPrompt assemble(RetrievalResult evidence, RepositoryMap repoMap, ModelProfile profile) {
        TokenBudgetManager manager = TokenBudgetManager.withDefaultWeights(profile);
        Budget budget = manager.allocate(assembler.describeSections(summary, evidence, repoMap, profile));
        return assembler.assemble(summary, evidence, repoMap, budget, manager);
    }

    private static EvidenceChunk chunk(String docId, String text, double score) {
        return new EvidenceChunk(docId, text, score, null, null, score);
    }
}
