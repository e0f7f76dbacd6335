package com.helix.scopecheck.model.change;

import com.google.common.base.Preconditions;

/**
 * Identifies a repository for the diff provider and the CI/CD parser.
 *
 * <p>For local checks {@code location} is a path (absolute or relative to the workspace
 * directory); for pull-request checks it is the repository slug.
 */
public record RepoRef(String location) {

    public RepoRef {
        Preconditions.checkArgument(location != null && !location.isBlank(), "Repository reference is required");
        location = location.trim();
    }

    @Override
    public String toString() {
        return location;
    }
}
