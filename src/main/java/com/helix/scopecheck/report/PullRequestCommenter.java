package com.helix.scopecheck.report;

import com.helix.scopecheck.model.change.RepoRef;

/**
 * Posts a scope check report back to the pull request it was computed for.
 */
public interface PullRequestCommenter {

    /**
     * @throws com.helix.scopecheck.exception.RepoUnavailableException if the comment cannot be posted
     */
    void comment(RepoRef repo, long pullRequestId, String markdown);
}
