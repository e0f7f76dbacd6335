package com.helix.scopecheck.diff;

import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.RepoRef;

/**
 * Source of a pull request's change, with the PR title and description as branch metadata.
 */
public interface PullRequestDiffProvider {

    ChangeSet getPullRequestChangeSet(RepoRef repo, long pullRequestId);
}
