package com.helix.scopecheck.model.retrieval;

import java.util.Objects;

/**
 * A retrieved unit of design-document context with its per-source and combined scores.
 * Component scores are {@code null} when the source did not return the chunk.
 *
 * @param sourceDocId design document id
 * @param text chunk text
 * @param vectorScore similarity normalized to [0,1] within the vector result set
 * @param graphDistance hop distance from the change, smaller is closer
 * @param relationalRank zero-based position in the most-recently-approved ordering
 * @param combinedScore weighted merge score used for ranking
 */
public record EvidenceChunk(String sourceDocId,
                            String text,
                            Double vectorScore,
                            Integer graphDistance,
                            Integer relationalRank,
                            double combinedScore) {

    public EvidenceChunk {
        Objects.requireNonNull(sourceDocId, "sourceDocId");
        Objects.requireNonNull(text, "text");
    }

    public ChunkKey key() {
        return new ChunkKey(sourceDocId, text);
    }

    /**
     * Identity used for deduplication across sources.
     */
    public record ChunkKey(String sourceDocId, String text) {
    }
}
