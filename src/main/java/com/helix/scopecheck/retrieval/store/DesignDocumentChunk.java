package com.helix.scopecheck.retrieval.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A chunk of a design document, tagged to its project. Written by the document store's indexing
 * side; read-only here.
 */
@Entity
@Table(name = "DESIGN_DOC_CHUNKS", indexes = {
        @Index(name = "idx_chunk_project_status", columnList = "project_id, status"),
        @Index(name = "idx_chunk_doc", columnList = "doc_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DesignDocumentChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private String projectId;

    @Column(name = "doc_id", nullable = false, length = 500)
    private String docId;

    @Column(name = "chunk_index")
    private int chunkIndex;

    @Lob
    @Column(name = "content", nullable = false)
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private DocumentStatus status;

    @Column(name = "approved_at")
    private Instant approvedAt;
}
