package com.helix.scopecheck.retrieval.store;

public enum DocumentStatus {
    DRAFT,
    APPROVED,
    SUPERSEDED
}
