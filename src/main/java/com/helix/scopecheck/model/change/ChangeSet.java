package com.helix.scopecheck.model.change;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structured diff between two refs. Immutable; created per check.
 */
public record ChangeSet(RepoRef repo,
                        String baseRef,
                        String headRef,
                        BranchMetadata metadata,
                        List<FileChange> files) {

    public ChangeSet {
        Objects.requireNonNull(repo, "repo");
        Objects.requireNonNull(baseRef, "baseRef");
        Objects.requireNonNull(headRef, "headRef");
        metadata = metadata == null ? BranchMetadata.EMPTY : metadata;
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Paths of every changed file in diff order. Renamed files contribute their new path only.
     */
    public Set<String> fileInventory() {
        Set<String> paths = new LinkedHashSet<>();
        files.forEach(f -> paths.add(f.path()));
        return Set.copyOf(paths);
    }

    public List<String> changedPaths() {
        return files.stream().map(FileChange::path).toList();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
