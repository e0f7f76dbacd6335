package com.helix.scopecheck.service;

import com.google.common.base.Preconditions;
import com.helix.scopecheck.model.change.RepoRef;

import java.util.Objects;

/**
 * Input of one scope check.
 *
 * @param headRef head branch of a local check; blank means the repository's current branch
 * @param pullRequestId only for {@link CheckMode#PULL_REQUEST}
 * @param description optional natural-language description used as the retrieval query
 */
public record ScopeCheckRequest(CheckMode mode,
                                RepoRef repo,
                                String baseRef,
                                String headRef,
                                Long pullRequestId,
                                String projectId,
                                String description) {

    public ScopeCheckRequest {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(repo, "repo");
        Preconditions.checkArgument(projectId != null && !projectId.isBlank(), "Project id is required");
        if (mode == CheckMode.PULL_REQUEST) {
            Preconditions.checkArgument(pullRequestId != null && pullRequestId > 0,
                    "A positive pull request id is required");
        }
        description = description == null ? "" : description.strip();
    }

    public static ScopeCheckRequest local(RepoRef repo, String baseRef, String headRef,
                                          String projectId, String description) {
        return new ScopeCheckRequest(CheckMode.LOCAL, repo, baseRef, headRef, null, projectId, description);
    }

    public static ScopeCheckRequest pullRequest(RepoRef repo, long pullRequestId,
                                                String projectId, String description) {
        return new ScopeCheckRequest(CheckMode.PULL_REQUEST, repo, null, null, pullRequestId, projectId, description);
    }
}
