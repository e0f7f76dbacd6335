package com.helix.scopecheck.model.change;

/**
 * Kind of change applied to a single file between two refs.
 */
public enum ChangeKind {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED;

    public String label() {
        return name().toLowerCase();
    }
}
