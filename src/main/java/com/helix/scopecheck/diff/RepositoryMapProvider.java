package com.helix.scopecheck.diff;

import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.model.change.RepositoryMap;

/**
 * Source of repository structure context for the judge.
 */
public interface RepositoryMapProvider {

    /**
     * Lists the files of {@code repo} at {@code ref}. Returns {@link RepositoryMap#EMPTY} when the
     * repository or ref is not available; the map is context only and never fails a check.
     */
    RepositoryMap getRepositoryMap(RepoRef repo, String ref);
}
