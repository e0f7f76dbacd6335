package com.helix.scopecheck.model.retrieval;

/**
 * Raw graph traversal match.
 *
 * @param sourceDocId design document the chunk belongs to
 * @param text chunk text
 * @param distance hop count from the nearest node matching a changed path or module
 */
public record GraphHit(String sourceDocId, String text, int distance) {
}
