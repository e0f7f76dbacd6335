package com.helix.scopecheck.retrieval;

import com.helix.scopecheck.model.retrieval.RetrievalQuery;
import com.helix.scopecheck.model.retrieval.VectorHit;

import java.util.List;

/**
 * Similarity search over embedded design-document chunks.
 */
public interface VectorDocumentIndex {

    /**
     * @return up to {@code topK} hits of the query's project, raw similarity scores
     */
    List<VectorHit> search(RetrievalQuery query, int topK);
}
