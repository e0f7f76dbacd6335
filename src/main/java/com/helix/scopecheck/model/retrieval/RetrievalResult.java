package com.helix.scopecheck.model.retrieval;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ranked, deduplicated evidence plus the sources that failed while producing it.
 */
public record RetrievalResult(List<EvidenceChunk> chunks, Set<RetrievalSource> degradedSources) {

    public RetrievalResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        degradedSources = degradedSources == null || degradedSources.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(degradedSources));
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public boolean isDegraded() {
        return !degradedSources.isEmpty();
    }
}
