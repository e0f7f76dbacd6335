package com.helix.scopecheck.service;

import com.helix.scopecheck.budget.Budget;
import com.helix.scopecheck.budget.ModelProfile;
import com.helix.scopecheck.budget.ModelProfileResolver;
import com.helix.scopecheck.budget.TokenBudgetManager;
import com.helix.scopecheck.cicd.CiConfigParser;
import com.helix.scopecheck.diff.DiffProvider;
import com.helix.scopecheck.diff.PullRequestDiffProvider;
import com.helix.scopecheck.diff.RepositoryMapProvider;
import com.helix.scopecheck.exception.AnalysisUnavailableException;
import com.helix.scopecheck.exception.InputException;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.judge.AlignmentJudge;
import com.helix.scopecheck.judge.JudgeOutcome;
import com.helix.scopecheck.judge.JudgeRequest;
import com.helix.scopecheck.model.CancellationToken;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.RepositoryMap;
import com.helix.scopecheck.model.cicd.WorkflowSpec;
import com.helix.scopecheck.model.prompt.AssembledPrompt;
import com.helix.scopecheck.model.retrieval.RetrievalQuery;
import com.helix.scopecheck.model.retrieval.RetrievalResult;
import com.helix.scopecheck.model.summary.DiffSummary;
import com.helix.scopecheck.model.verdict.AlignmentVerdict;
import com.helix.scopecheck.model.verdict.ScopeCheckResult;
import com.helix.scopecheck.prompt.PromptAssembler;
import com.helix.scopecheck.report.PullRequestCommenter;
import com.helix.scopecheck.report.ReportBuilder;
import com.helix.scopecheck.report.ReportPublisher;
import com.helix.scopecheck.report.ScoreAggregator;
import com.helix.scopecheck.retrieval.HybridRetriever;
import com.helix.scopecheck.summary.DiffSummarizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs the scope check pipeline: diff and CI/CD parsing in parallel, then retrieval alongside
 * summarization and the repository map, then budgeting, prompt assembly, the judge, aggregation and publication.
 *
 * <p>Each check owns its change set, evidence and budget; concurrent checks share nothing mutable.
 */
@Slf4j
@Service
public class ScopeCheckService {

    static final String MDC_CHECK_ID = "checkId";

    private final DiffProvider diffProvider;
    private final PullRequestDiffProvider pullRequestDiffProvider;
    private final RepositoryMapProvider repositoryMapProvider;
    private final CiConfigParser ciConfigParser;
    private final DiffSummarizer diffSummarizer;
    private final HybridRetriever hybridRetriever;
    private final ModelProfileResolver profileResolver;
    private final PromptAssembler promptAssembler;
    private final AlignmentJudge alignmentJudge;
    private final ScoreAggregator scoreAggregator;
    private final ReportBuilder reportBuilder;
    private final ReportPublisher reportPublisher;
    private final PullRequestCommenter pullRequestCommenter;
    private final Executor checkExecutor;
    private final Executor fanOutExecutor;

    public ScopeCheckService(DiffProvider diffProvider,
                             PullRequestDiffProvider pullRequestDiffProvider,
                             RepositoryMapProvider repositoryMapProvider,
                             CiConfigParser ciConfigParser,
                             DiffSummarizer diffSummarizer,
                             HybridRetriever hybridRetriever,
                             ModelProfileResolver profileResolver,
                             PromptAssembler promptAssembler,
                             AlignmentJudge alignmentJudge,
                             ScoreAggregator scoreAggregator,
                             ReportBuilder reportBuilder,
                             ReportPublisher reportPublisher,
                             PullRequestCommenter pullRequestCommenter,
                             @Qualifier("scopeCheckExecutor") Executor checkExecutor,
                             @Qualifier("fanOutExecutor") Executor fanOutExecutor) {
        this.diffProvider = diffProvider;
        this.pullRequestDiffProvider = pullRequestDiffProvider;
        this.repositoryMapProvider = repositoryMapProvider;
        this.ciConfigParser = ciConfigParser;
        this.diffSummarizer = diffSummarizer;
        this.hybridRetriever = hybridRetriever;
        this.profileResolver = profileResolver;
        this.promptAssembler = promptAssembler;
        this.alignmentJudge = alignmentJudge;
        this.scoreAggregator = scoreAggregator;
        this.reportBuilder = reportBuilder;
        this.reportPublisher = reportPublisher;
        this.pullRequestCommenter = pullRequestCommenter;
        this.checkExecutor = checkExecutor;
        this.fanOutExecutor = fanOutExecutor;
    }

    /**
     * Runs a check on the calling thread.
     */
    public ScopeCheckResult check(ScopeCheckRequest request) {
        return run(request, new CancellationToken(newCheckId()));
    }

    /**
     * Runs a check on the scope check executor.
     */
    public ScopeCheckHandle submit(ScopeCheckRequest request) {
        CancellationToken token = new CancellationToken(newCheckId());
        CompletableFuture<ScopeCheckResult> future =
                CompletableFuture.supplyAsync(() -> run(request, token), checkExecutor);
        return new ScopeCheckHandle(future, token);
    }

    ScopeCheckResult run(ScopeCheckRequest request, CancellationToken token) {
        String checkId = token.getCheckId();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_CHECK_ID, checkId)) {
            log.info("Scope check {} started: mode={}, repo={}, project='{}'",
                    checkId, request.mode(), request.repo(), request.projectId());
            long start = System.currentTimeMillis();
            try {
                ScopeCheckResult result = execute(request, token);
                reportPublisher.publish(result);
                commentOnPullRequest(request, result);
                log.info("Scope check {} completed in {}ms: score={}, approvalRequired={}",
                        checkId, System.currentTimeMillis() - start,
                        result.verdict().alignmentScore(), result.verdict().approvalRequired());
                return result;
            } catch (AnalysisUnavailableException e) {
                reportPublisher.publishFailure(checkId, request.projectId(), e.getMessage());
                throw e;
            }
        }
    }

    private ScopeCheckResult execute(ScopeCheckRequest request, CancellationToken token) {
        token.throwIfCancelled();

        CompletableFuture<ChangeSet> changeSetFuture = async(() -> loadChangeSet(request));
        CompletableFuture<List<WorkflowSpec>> workflowsFuture = async(() -> ciConfigParser.parseWorkflows(request.repo()));
        ChangeSet changeSet = join(changeSetFuture);
        List<WorkflowSpec> workflows = join(workflowsFuture);

        if (changeSet.isEmpty()) {
            throw new InputException("No changes between " + changeSet.baseRef() + " and " + changeSet.headRef());
        }
        token.throwIfCancelled();

        ModelProfile profile = profileResolver.resolve();
        // the retriever fans out on its own; summarizing and the tree listing run beside it
        CompletableFuture<DiffSummary> summaryFuture = async(() -> diffSummarizer.summarize(changeSet, workflows));
        CompletableFuture<RepositoryMap> repoMapFuture =
                async(() -> repositoryMapProvider.getRepositoryMap(request.repo(), changeSet.headRef()));
        RetrievalResult evidence = hybridRetriever.retrieve(
                RetrievalQuery.from(changeSet, request.projectId(), request.description()), profile.retrievalTopK());
        DiffSummary summary = join(summaryFuture);
        RepositoryMap repoMap = join(repoMapFuture);
        token.throwIfCancelled();

        TokenBudgetManager budgetManager = profileResolver.budgetManager(profile);
        Budget budget = budgetManager.allocate(promptAssembler.describeSections(summary, evidence, repoMap, profile));
        AssembledPrompt prompt = promptAssembler.assemble(summary, evidence, repoMap, budget, budgetManager);
        log.info("Prompt ready: profile={}, template={}, {}", profile.name(), prompt.templateName(), budget.summary());

        JudgeOutcome outcome = alignmentJudge.judge(
                new JudgeRequest(prompt, changeSet.fileInventory(), evidence.isEmpty(), token));

        AlignmentVerdict verdict = scoreAggregator.aggregate(outcome.verdict());
        String report = reportBuilder.render(verdict, evidence.degradedSources());
        return new ScopeCheckResult(token.getCheckId(), request.projectId(), verdict, report,
                evidence.degradedSources(), evidence.chunks().size(), outcome.attempts(), outcome.repairCycles());
    }

    /**
     * Pull request checks with violations also get the report as a PR comment. A failed comment
     * is logged; the verdict is still returned.
     */
    private void commentOnPullRequest(ScopeCheckRequest request, ScopeCheckResult result) {
        if (request.mode() != CheckMode.PULL_REQUEST || result.verdict().violations().isEmpty()) {
            return;
        }
        try {
            pullRequestCommenter.comment(request.repo(), request.pullRequestId(), result.report());
        } catch (RepoUnavailableException e) {
            log.warn("Scope check {}: could not comment on pull request #{}: {}",
                    result.checkId(), request.pullRequestId(), e.getMessage());
        }
    }

    private ChangeSet loadChangeSet(ScopeCheckRequest request) {
        return switch (request.mode()) {
            case LOCAL -> diffProvider.getChangeSet(request.repo(), request.baseRef(), request.headRef());
            case PULL_REQUEST -> pullRequestDiffProvider.getPullRequestChangeSet(request.repo(), request.pullRequestId());
        };
    }

    private <T> CompletableFuture<T> async(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.get();
            } finally {
                MDC.clear();
            }
        }, fanOutExecutor);
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String newCheckId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
