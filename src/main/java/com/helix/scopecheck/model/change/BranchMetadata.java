package com.helix.scopecheck.model.change;

/**
 * PR-like description of a branch comparison.
 *
 * @param title first commit subject, or the pull request title
 * @param description commit subjects joined by newlines, or the pull request body
 * @param commitCount number of commits between base and head
 */
public record BranchMetadata(String title, String description, int commitCount) {

    public static final BranchMetadata EMPTY = new BranchMetadata("(no commits)", "", 0);

    public BranchMetadata {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
    }
}
