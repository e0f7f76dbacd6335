package com.helix.scopecheck.retrieval.store;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DesignDocumentChunkRepository extends JpaRepository<DesignDocumentChunk, Long> {

    /**
     * Chunks of the project's documents in the given status, most recently approved first.
     */
    @Query("SELECT c FROM DesignDocumentChunk c "
            + "WHERE c.projectId = :projectId AND c.status = :status "
            + "ORDER BY c.approvedAt DESC, c.docId ASC, c.chunkIndex ASC")
    List<DesignDocumentChunk> findByProjectAndStatus(@Param("projectId") String projectId,
                                                     @Param("status") DocumentStatus status,
                                                     Pageable page);
}
