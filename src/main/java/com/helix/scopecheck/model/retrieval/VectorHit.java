package com.helix.scopecheck.model.retrieval;

/**
 * Raw similarity match from the vector index.
 *
 * @param sourceDocId design document the chunk belongs to
 * @param text chunk text
 * @param score raw similarity score as returned by the index
 */
public record VectorHit(String sourceDocId, String text, double score) {
}
