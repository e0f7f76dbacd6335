package com.helix.scopecheck.controller;

import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.model.dto.LocalScopeCheckRequest;
import com.helix.scopecheck.model.dto.PullRequestScopeCheckRequest;
import com.helix.scopecheck.model.dto.ScopeCheckResponse;
import com.helix.scopecheck.model.verdict.ScopeCheckResult;
import com.helix.scopecheck.service.ScopeCheckRequest;
import com.helix.scopecheck.service.ScopeCheckService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for scope checks. Both endpoints block until the verdict is published;
 * failures are mapped by {@link ScopeCheckExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scope-checks")
@RequiredArgsConstructor
public class ScopeCheckController {

    private final ScopeCheckService scopeCheckService;

    @PostMapping("/local")
    public ResponseEntity<ScopeCheckResponse> checkLocal(@Valid @RequestBody LocalScopeCheckRequest request) {
        log.info("Local scope check requested: repo={}, base={}, head={}, project={}",
                request.getRepoPath(), request.getBaseBranch(), request.getHeadBranch(), request.getProjectId());

        ScopeCheckResult result = scopeCheckService.check(ScopeCheckRequest.local(
                new RepoRef(request.getRepoPath()),
                request.getBaseBranch(),
                request.getHeadBranch(),
                request.getProjectId(),
                request.getDescription()));
        return ResponseEntity.ok(ScopeCheckResponse.from(result));
    }

    @PostMapping("/pull-requests")
    public ResponseEntity<ScopeCheckResponse> checkPullRequest(@Valid @RequestBody PullRequestScopeCheckRequest request) {
        log.info("Pull request scope check requested: repo={}, pr={}, project={}",
                request.getRepoSlug(), request.getPullRequestId(), request.getProjectId());

        ScopeCheckResult result = scopeCheckService.check(ScopeCheckRequest.pullRequest(
                new RepoRef(request.getRepoSlug()),
                request.getPullRequestId(),
                request.getProjectId(),
                request.getDescription()));
        return ResponseEntity.ok(ScopeCheckResponse.from(result));
    }
}
