package com.helix.scopecheck.model.retrieval;

/**
 * The three query surfaces of the design-document store.
 */
public enum RetrievalSource {
    VECTOR,
    GRAPH,
    RELATIONAL
}
