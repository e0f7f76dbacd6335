package com.helix.scopecheck.retrieval;

import com.helix.scopecheck.model.retrieval.GraphHit;
import com.helix.scopecheck.model.retrieval.RetrievalQuery;

import java.util.List;

/**
 * Graph traversal from code paths and modules to the design chunks that describe them.
 */
public interface GraphDocumentIndex {

    /**
     * @param maxHops upper bound of the traversal, inclusive
     * @return hits with their hop distance from the nearest matched code node
     */
    List<GraphHit> traverse(RetrievalQuery query, int maxHops, int limit);
}
