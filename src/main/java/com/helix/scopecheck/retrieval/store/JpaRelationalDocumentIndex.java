package com.helix.scopecheck.retrieval.store;

import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.retrieval.RelationalHit;
import com.helix.scopecheck.retrieval.RelationalDocumentIndex;
import com.helix.scopecheck.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaRelationalDocumentIndex implements RelationalDocumentIndex {

    private final DesignDocumentChunkRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<RelationalHit> findApproved(String projectId, int limit) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DOCUMENT_DB, "FindApprovedChunks", log);
        ctx.logRequest("Approved documents of project", "project", projectId, "limit", limit);
        try {
            List<RelationalHit> hits = repository
                    .findByProjectAndStatus(projectId, DocumentStatus.APPROVED, PageRequest.of(0, limit))
                    .stream()
                    .map(c -> new RelationalHit(c.getDocId(), c.getContent(), c.getApprovedAt()))
                    .toList();
            ctx.logResponse("Approved chunks loaded", "chunks", hits.size());
            return hits;
        } catch (DataAccessException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }
}
