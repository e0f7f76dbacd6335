package com.helix.scopecheck.model.change;

import java.util.List;

/**
 * File listing of the head tree, given to the judge as repository structure context.
 *
 * @param paths listed paths in tree order, capped at {@code app.summary.repo-map-max-files}
 * @param totalFiles number of listable files in the tree, including those past the cap
 */
public record RepositoryMap(List<String> paths, int totalFiles) {

    public static final RepositoryMap EMPTY = new RepositoryMap(List.of(), 0);

    public RepositoryMap {
        paths = paths == null ? List.of() : List.copyOf(paths);
        totalFiles = Math.max(totalFiles, paths.size());
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }
}
