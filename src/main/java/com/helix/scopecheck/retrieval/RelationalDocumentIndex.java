package com.helix.scopecheck.retrieval;

import com.helix.scopecheck.model.retrieval.RelationalHit;

import java.util.List;

/**
 * Metadata filter over approved design documents.
 */
public interface RelationalDocumentIndex {

    /**
     * @return chunks of documents approved for the project, most recently approved first
     */
    List<RelationalHit> findApproved(String projectId, int limit);
}
