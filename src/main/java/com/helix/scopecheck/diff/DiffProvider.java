package com.helix.scopecheck.diff;

import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.RepoRef;

/**
 * Source of the change under review.
 */
public interface DiffProvider {

    /**
     * Computes the change between two refs.
     *
     * @throws com.helix.scopecheck.exception.RefNotFoundException if either ref does not exist
     * @throws com.helix.scopecheck.exception.RepoUnavailableException if the repository cannot be read
     */
    ChangeSet getChangeSet(RepoRef repo, String base, String head);
}
