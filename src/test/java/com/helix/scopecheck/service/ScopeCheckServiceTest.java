package com.helix.scopecheck.service;

import com.helix.scopecheck.budget.DecodingMode;
import com.helix.scopecheck.budget.ModelProfileResolver;
import com.helix.scopecheck.client.ModelInvoker;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.diff.DiffProvider;
import com.helix.scopecheck.diff.PullRequestDiffProvider;
import com.helix.scopecheck.exception.AnalysisUnavailableException;
import com.helix.scopecheck.exception.InputException;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.exception.ScopeCheckCancelledException;
import com.helix.scopecheck.judge.AlignmentJudge;
import com.helix.scopecheck.judge.VerdictParser;
import com.helix.scopecheck.model.change.BranchMetadata;
import com.helix.scopecheck.model.change.ChangeKind;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.Hunk;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.model.change.RepositoryMap;
import com.helix.scopecheck.model.retrieval.RelationalHit;
import com.helix.scopecheck.model.retrieval.RetrievalSource;
import com.helix.scopecheck.model.retrieval.VectorHit;
import com.helix.scopecheck.model.verdict.ScopeCheckResult;
import com.helix.scopecheck.model.verdict.Severity;
import com.helix.scopecheck.model.verdict.Violation;
import com.helix.scopecheck.model.verdict.ViolationKind;
import com.helix.scopecheck.prompt.PromptAssembler;
import com.helix.scopecheck.prompt.PromptLibraryService;
import com.helix.scopecheck.prompt.VerdictSchema;
import com.helix.scopecheck.report.ReportBuilder;
import com.helix.scopecheck.report.ReportPublisher;
import com.helix.scopecheck.report.ScoreAggregator;
import com.helix.scopecheck.retrieval.GraphDocumentIndex;
import com.helix.scopecheck.retrieval.HybridRetriever;
import com.helix.scopecheck.retrieval.RelationalDocumentIndex;
import com.helix.scopecheck.retrieval.VectorDocumentIndex;
import com.helix.scopecheck.summary.DiffSummarizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Scope Check Service Tests")
class ScopeCheckServiceTest {

    private static final Executor DIRECT = Runnable::run;
    private static final RepoRef REPO = new RepoRef("payments");

    private static final ChangeSet FRAUD_CHANGE = new ChangeSet(REPO, "main", "feature/fraud",
            new BranchMetadata("Add fraud scoring", "Add fraud scoring to payments", 2),
            List.of(FileChange.of("src/payments/fraud.py", ChangeKind.ADDED,
                            List.of(new Hunk(1, 3, "@@ -0,0 +1,3 @@\n+def score(txn):\n+    model = load()\n+    return model(txn)"))),
                    FileChange.of("src/payments/grpc.py", ChangeKind.MODIFIED,
                            List.of(new Hunk(12, 12, "@@ -12 +12 @@\n-PORT = 8080\n+PORT = 50051")))));

    private static final String SCOPE_CREEP_VERDICT = """
            {"alignment_score": 0.35,
             "violations": [{"kind": "scope_creep", "severity": "critical", "file_path": "src/payments/fraud.py",
                             "description": "Fraud scoring is not part of the approved payments design.",
                             "recommendation": "Get the fraud module approved separately."}],
             "summary": "The change adds fraud scoring, which the design does not cover.",
             "approval_required": false}
            """;

    private final AppProperties properties = new AppProperties();
    private final RecordingPublisher publisher = new RecordingPublisher();

    private ChangeSet changeSet;
    private ChangeSet pullRequestChangeSet;
    private List<VectorHit> vectorHits;
    private List<RelationalHit> relationalHits;
    private ScriptedInvoker invoker;
    private RepositoryMap repoMap;
    private final List<String> mapRequests = new ArrayList<>();
    private final List<String> comments = new ArrayList<>();
    private RepoUnavailableException commentFailure;

    @BeforeEach
    void setUp() {
        properties.setWorkspaceDir("/tmp/workspace");
        changeSet = FRAUD_CHANGE;
        pullRequestChangeSet = null;
        vectorHits = List.of(new VectorHit("design-payments", "Payments v2 covers REST refunds only.", 0.82));
        relationalHits = List.of(new RelationalHit("design-payments", "Payments v2 covers REST refunds only.",
                Instant.parse("2024-05-01T10:00:00Z")));
        invoker = new ScriptedInvoker();
        repoMap = RepositoryMap.EMPTY;
    }

    @Test
    @DisplayName("Should flag an unapproved module as critical scope creep and require approval")
    void flagsScopeCreep() {
        // Given
        invoker.thenReturn(SCOPE_CREEP_VERDICT);

        // When
        ScopeCheckResult result = service().check(localRequest());

        // Then
        assertEquals(0.35, result.verdict().alignmentScore(), 1e-9);
        assertTrue(result.verdict().approvalRequired());
        Violation violation = result.verdict().violations().get(0);
        assertEquals(ViolationKind.SCOPE_CREEP, violation.kind());
        assertEquals(Severity.CRITICAL, violation.severity());
        assertEquals("src/payments/fraud.py", violation.filePath());
        assertThat(result.report())
                .contains("- [CRITICAL] **scope_creep** in `src/payments/fraud.py`")
                .contains("**Approval required:** true");
        assertEquals(1, result.evidenceCount());
        assertEquals(1, result.attempts());
        assertFalse(result.lowConfidence());

        assertThat(invoker.prompts.get(0))
                .contains("### DIFF SUMMARY")
                .contains("src/payments/fraud.py")
                .contains("[doc: design-payments]");
        assertThat(publisher.published).containsExactly(result);
        assertThat(publisher.failures).isEmpty();
    }

    @Test
    @DisplayName("Should give the model the head tree of the repository")
    void includesRepositoryMap() {
        // Given
        repoMap = new RepositoryMap(List.of("src/payments/api.py", "src/payments/fraud.py", "src/payments/grpc.py"), 3);
        invoker.thenReturn(SCOPE_CREEP_VERDICT);

        // When
        service().check(localRequest());

        // Then
        assertThat(mapRequests).containsExactly("payments@feature/fraud");
        String prompt = invoker.prompts.get(0);
        assertThat(prompt).contains("#### REPOSITORY MAP (3 files)\n- src/payments/api.py");
        assertThat(prompt.indexOf("#### REPOSITORY MAP")).isLessThan(prompt.indexOf("### APPROVED DESIGN EVIDENCE"));
    }

    @Test
    @DisplayName("Should tell the model and the reader when no approved design exists")
    void notesMissingDesign() {
        // Given
        vectorHits = List.of();
        relationalHits = List.of();
        invoker.thenReturn("{\"alignment_score\": 0.5, \"violations\": [], \"summary\": \"Cannot confirm scope.\"}");

        // When
        ScopeCheckResult result = service().check(localRequest());

        // Then
        assertThat(invoker.prompts.get(0)).contains("No approved design documents were found for this project.");
        assertEquals("No approved design found for this project. Cannot confirm scope.", result.verdict().summary());
        assertEquals(0, result.evidenceCount());
        assertTrue(result.verdict().approvalRequired());
    }

    @Test
    @DisplayName("Should repair a malformed answer before accepting it")
    void repairsMalformedAnswer() {
        // Given
        invoker.thenReturn("I think this looks fine.").thenReturn(SCOPE_CREEP_VERDICT);

        // When
        ScopeCheckResult result = service().check(localRequest());

        // Then
        assertEquals(2, result.attempts());
        assertEquals(1, result.repairCycles());
        assertThat(invoker.prompts.get(1)).contains("### CORRECTION");
        assertThat(publisher.published).hasSize(1);
    }

    @Test
    @DisplayName("Should publish a failure and no verdict when the analysis is unavailable")
    void publishesFailure() {
        // Given
        invoker.thenReturn("nope").thenReturn("still nope").thenReturn("no");

        // When
        assertThrows(AnalysisUnavailableException.class, () -> service().check(localRequest()));

        // Then
        assertThat(publisher.published).isEmpty();
        assertThat(publisher.failures).hasSize(1);
        assertThat(publisher.failures.get(0)).startsWith("payments:");
    }

    @Test
    @DisplayName("Should reject a change set without changes before calling the model")
    void rejectsEmptyChange() {
        // Given
        changeSet = new ChangeSet(REPO, "main", "main", BranchMetadata.EMPTY, List.of());

        // When
        InputException e = assertThrows(InputException.class, () -> service().check(localRequest()));

        // Then
        assertEquals("No changes between main and main", e.getMessage());
        assertThat(invoker.prompts).isEmpty();
        assertThat(publisher.published).isEmpty();
        assertThat(publisher.failures).isEmpty();
    }

    @Test
    @DisplayName("Should read pull requests through the pull request provider")
    void checksPullRequest() {
        // Given
        pullRequestChangeSet = FRAUD_CHANGE;
        invoker.thenReturn(SCOPE_CREEP_VERDICT);

        // When
        ScopeCheckResult result = service().check(ScopeCheckRequest.pullRequest(REPO, 42, "payments", null));

        // Then
        assertTrue(result.verdict().approvalRequired());
        assertEquals("payments", result.projectId());
        assertThat(comments).containsExactly("payments#42\n" + result.report());
    }

    @Test
    @DisplayName("Should comment on pull requests only when violations were found")
    void commentsOnlyOnViolations() {
        // Given
        pullRequestChangeSet = FRAUD_CHANGE;
        invoker.thenReturn("{\"alignment_score\": 0.95, \"violations\": [], \"summary\": \"Aligned.\"}")
                .thenReturn(SCOPE_CREEP_VERDICT);

        // When
        service().check(ScopeCheckRequest.pullRequest(REPO, 42, "payments", null));
        service().check(localRequest());

        // Then
        assertThat(comments).isEmpty();
        assertThat(publisher.published).hasSize(2);
    }

    @Test
    @DisplayName("Should keep the verdict when the pull request comment fails")
    void keepsVerdictWhenCommentFails() {
        // Given
        pullRequestChangeSet = FRAUD_CHANGE;
        commentFailure = new RepoUnavailableException("Bitbucket API error for payments: 503");
        invoker.thenReturn(SCOPE_CREEP_VERDICT);

        // When
        ScopeCheckResult result = service().check(ScopeCheckRequest.pullRequest(REPO, 42, "payments", null));

        // Then
        assertEquals(0.35, result.verdict().alignmentScore(), 1e-9);
        assertThat(publisher.published).containsExactly(result);
        assertThat(comments).isEmpty();
    }

    @Test
    @DisplayName("Should mark the result low confidence when a retrieval source fails")
    void degradesWhenSourceFails() {
        // Given
        invoker.thenReturn(SCOPE_CREEP_VERDICT);
        GraphDocumentIndex failingGraph = (q, hops, limit) -> {
            throw new IllegalStateException("neo4j down");
        };

        // When
        ScopeCheckResult result = service(failingGraph, DIRECT).check(localRequest());

        // Then
        assertTrue(result.lowConfidence());
        assertThat(result.degradedSources()).containsExactly(RetrievalSource.GRAPH);
        assertThat(result.report()).endsWith("**Confidence:** low (retrieval sources unavailable: graph)");
    }

    @Test
    @DisplayName("Should stop a submitted check that was cancelled and publish nothing")
    void cancelsSubmittedCheck() {
        // Given
        List<Runnable> queued = new ArrayList<>();
        ScopeCheckService service = service((q, hops, limit) -> List.of(), queued::add);
        invoker.thenReturn(SCOPE_CREEP_VERDICT);

        // When
        ScopeCheckHandle handle = service.submit(localRequest());
        assertTrue(handle.cancel());
        queued.forEach(Runnable::run);

        // Then
        assertTrue(handle.isCancelled());
        CompletionException e = assertThrows(CompletionException.class, () -> handle.getResult().join());
        assertInstanceOf(ScopeCheckCancelledException.class, e.getCause());
        assertThat(invoker.prompts).isEmpty();
        assertThat(publisher.published).isEmpty();
        assertThat(publisher.failures).isEmpty();
    }

    @Test
    @DisplayName("Should reject requests without a project")
    void validatesRequest() {
        assertThrows(IllegalArgumentException.class,
                () -> ScopeCheckRequest.local(REPO, "main", "feature", " ", "d"));
        assertThrows(IllegalArgumentException.class,
                () -> ScopeCheckRequest.pullRequest(REPO, 0, "payments", "d"));
        assertEquals("", ScopeCheckRequest.local(REPO, "main", null, "payments", null).description());
        assertNull(ScopeCheckRequest.local(REPO, "main", null, "payments", null).pullRequestId());
    }

    private ScopeCheckRequest localRequest() {
        return ScopeCheckRequest.local(REPO, "main", "feature/fraud", "payments", "Add fraud scoring");
    }

    private ScopeCheckService service() {
        return service((q, hops, limit) -> List.of(), DIRECT);
    }

    private ScopeCheckService service(GraphDocumentIndex graphIndex, Executor checkExecutor) {
        DiffProvider diffProvider = (repo, base, head) -> changeSet;
        PullRequestDiffProvider pullRequestDiffProvider = (repo, id) -> pullRequestChangeSet;
        VectorDocumentIndex vectorIndex = (q, k) -> vectorHits;
        RelationalDocumentIndex relationalIndex = (projectId, limit) -> relationalHits;

        PromptLibraryService library = new PromptLibraryService();
        library.loadPrompts();
        VerdictSchema schema = new VerdictSchema();
        PromptAssembler assembler = new PromptAssembler(library, schema, properties);

        return new ScopeCheckService(
                diffProvider,
                pullRequestDiffProvider,
                (repo, ref) -> {
                    mapRequests.add(repo.location() + "@" + ref);
                    return repoMap;
                },
                repo -> List.of(),
                new DiffSummarizer(properties),
                new HybridRetriever(vectorIndex, graphIndex, relationalIndex, properties, DIRECT),
                new ModelProfileResolver(properties),
                assembler,
                new AlignmentJudge(invoker, new VerdictParser(), assembler, schema, properties),
                new ScoreAggregator(properties),
                new ReportBuilder(),
                publisher,
                (repo, pullRequestId, markdown) -> {
                    if (commentFailure != null) {
                        throw commentFailure;
                    }
                    comments.add(repo.location() + "#" + pullRequestId + "\n" + markdown);
                },
                checkExecutor,
                DIRECT);
    }

    private static final class ScriptedInvoker implements ModelInvoker {
        private final Deque<String> script = new ArrayDeque<>();
        private final List<String> prompts = new ArrayList<>();

        ScriptedInvoker thenReturn(String output) {
            script.add(output);
            return this;
        }

        @Override
        public String invoke(String prompt, String schema, DecodingMode decodingMode) {
            prompts.add(prompt);
            return script.poll();
        }
    }

    private static final class RecordingPublisher implements ReportPublisher {
        private final List<ScopeCheckResult> published = new ArrayList<>();
        private final List<String> failures = new ArrayList<>();

        @Override
        public void publish(ScopeCheckResult result) {
            published.add(result);
        }

        @Override
        public void publishFailure(String checkId, String projectId, String reason) {
            failures.add(projectId + ": " + reason);
        }
    }
}
