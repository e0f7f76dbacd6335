package com.helix.scopecheck.retrieval;

import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.exception.AnalysisUnavailableException;
import com.helix.scopecheck.model.retrieval.EvidenceChunk;
import com.helix.scopecheck.model.retrieval.GraphHit;
import com.helix.scopecheck.model.retrieval.RelationalHit;
import com.helix.scopecheck.model.retrieval.RetrievalQuery;
import com.helix.scopecheck.model.retrieval.RetrievalResult;
import com.helix.scopecheck.model.retrieval.RetrievalSource;
import com.helix.scopecheck.model.retrieval.VectorHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Hybrid Retriever Tests")
class HybridRetrieverTest {

    private static final Executor DIRECT = Runnable::run;
    private static final RetrievalQuery QUERY =
            new RetrievalQuery("payments", List.of("src/payments/fraud.py"), List.of("payments"), "Add fraud scoring");
    private static final Instant APPROVED = Instant.parse("2024-05-01T10:00:00Z");

    private AppProperties properties;

    private List<VectorHit> vectorHits;
    private List<GraphHit> graphHits;
    private List<RelationalHit> relationalHits;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.setWorkspaceDir("/tmp/workspace");
        vectorHits = List.of(
                new VectorHit("design-rest", "Payments expose a REST API only.", 0.9),
                new VectorHit("design-grpc", "gRPC was considered and rejected.", 0.5),
                new VectorHit("design-misc", "Amounts are stored in cents.", 0.7));
        graphHits = List.of(
                new GraphHit("design-grpc", "gRPC was considered and rejected.", 1),
                new GraphHit("design-ops", "Deploys go through the release train.", 2));
        relationalHits = List.of(
                new RelationalHit("design-rest", "Payments expose a REST API only.", APPROVED),
                new RelationalHit("design-misc", "Amounts are stored in cents.", APPROVED.minusSeconds(3600)));
    }

    @Test
    @DisplayName("Should normalize each source and rank by the weighted combined score")
    void mergeRanksByCombinedScore() {
        // Given
        HybridRetriever retriever = retriever(
                (q, k) -> vectorHits, (q, hops, limit) -> graphHits, (p, limit) -> relationalHits);

        // When
        List<EvidenceChunk> merged = retriever.merge(vectorHits, graphHits, relationalHits);

        // Then: rest = (1 + 0 + 1) / 3, misc = (0.5 + 0 + 0.5) / 3, grpc = (0 + 0.5 + 0) / 3, ops = 0
        assertThat(merged).extracting(EvidenceChunk::sourceDocId)
                .containsExactly("design-rest", "design-misc", "design-grpc", "design-ops");
        assertThat(merged.get(0).combinedScore()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(merged.get(1).combinedScore()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(merged.get(2).combinedScore()).isCloseTo(0.5 / 3, within(1e-9));
        assertThat(merged.get(3).combinedScore()).isZero();

        EvidenceChunk grpc = merged.get(2);
        assertThat(grpc.vectorScore()).isZero();
        assertEquals(1, grpc.graphDistance());
        assertThat(grpc.relationalRank()).isNull();
        assertThat(merged).allSatisfy(c -> assertThat(c.combinedScore()).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Should break score ties by graph distance and then by document id")
    void mergeTieBreaks() {
        // Given: graph weight 0 so distances only order ties
        properties.getRetrieval().setGraphWeight(0.0);
        HybridRetriever retriever = retriever((q, k) -> List.of(), (q, h, l) -> List.of(), (p, l) -> List.of());
        List<VectorHit> vectors = List.of(
                new VectorHit("x", "far", 0.8),
                new VectorHit("y", "near", 0.8),
                new VectorHit("z", "unlinked", 0.8),
                new VectorHit("w", "unlinked", 0.8));
        List<GraphHit> graph = List.of(new GraphHit("x", "far", 2), new GraphHit("y", "near", 1));

        // When
        List<EvidenceChunk> merged = retriever.merge(vectors, graph, List.of());

        // Then
        assertThat(merged).extracting(EvidenceChunk::sourceDocId).containsExactly("y", "x", "w", "z");
        assertThat(merged).extracting(EvidenceChunk::combinedScore).containsOnly(0.5);
    }

    @Test
    @DisplayName("Should fuse duplicates and produce the same ranking on every run")
    void mergeDeduplicatesAndIsIdempotent() {
        HybridRetriever retriever = retriever((q, k) -> List.of(), (q, h, l) -> List.of(), (p, l) -> List.of());
        List<VectorHit> vectors = List.of(
                new VectorHit("doc", "same text", 0.3),
                new VectorHit("doc", "same text", 0.9),
                new VectorHit("other", "other text", 0.5));

        List<EvidenceChunk> first = retriever.merge(vectors, graphHits, relationalHits);
        List<EvidenceChunk> second = retriever.merge(vectors, graphHits, relationalHits);

        assertEquals(first, second);
        assertThat(first).filteredOn(c -> c.sourceDocId().equals("doc")).hasSize(1)
                .first().extracting(EvidenceChunk::vectorScore).isEqualTo(1.0);
        assertThat(first).extracting(EvidenceChunk::key).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Should continue without a failed source and record it as degraded")
    void retrieveDegradesOnSourceFailure() {
        // Given
        AtomicInteger graphCalls = new AtomicInteger();
        HybridRetriever retriever = retriever(
                (q, k) -> vectorHits,
                (q, hops, limit) -> {
                    graphCalls.incrementAndGet();
                    throw new IllegalStateException("neo4j down");
                },
                (p, limit) -> relationalHits);

        // When
        RetrievalResult result = retriever.retrieve(QUERY, 5);

        // Then
        assertEquals(1, graphCalls.get());
        assertThat(result.degradedSources()).containsExactly(RetrievalSource.GRAPH);
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.chunks()).extracting(EvidenceChunk::sourceDocId)
                .containsExactly("design-rest", "design-misc", "design-grpc");
    }

    @Test
    @DisplayName("Should record a source as degraded when the lookup pool rejects it")
    void retrieveDegradesWhenPoolRejects() {
        // Given: the pool accepts two lookups and rejects the third
        AtomicInteger submitted = new AtomicInteger();
        Executor saturated = task -> {
            if (submitted.incrementAndGet() > 2) {
                throw new TaskRejectedException("fan-out pool is full");
            }
            task.run();
        };
        HybridRetriever retriever = new HybridRetriever(
                (q, k) -> vectorHits, (q, hops, limit) -> graphHits, (p, limit) -> relationalHits, properties, saturated);

        // When
        RetrievalResult result = retriever.retrieve(QUERY, 5);

        // Then
        assertThat(result.degradedSources()).containsExactly(RetrievalSource.RELATIONAL);
        assertThat(result.chunks()).extracting(EvidenceChunk::sourceDocId).contains("design-rest", "design-ops");
    }

    @Test
    @DisplayName("Should return an empty result when the project has no documents")
    void retrieveEmptyProject() {
        HybridRetriever retriever = retriever((q, k) -> List.of(), (q, h, l) -> List.of(), (p, l) -> List.of());

        RetrievalResult result = retriever.retrieve(QUERY, 5);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Should pass top-K, hop bound and relational limit to the sources")
    void retrievePassesLimits() {
        properties.getRetrieval().setMaxHops(3);
        properties.getRetrieval().setRelationalLimit(7);
        int[] seen = new int[4];
        HybridRetriever retriever = retriever(
                (q, k) -> {
                    seen[0] = k;
                    return List.of();
                },
                (q, hops, limit) -> {
                    seen[1] = hops;
                    seen[2] = limit;
                    return List.of();
                },
                (p, limit) -> {
                    seen[3] = limit;
                    return List.of();
                });

        retriever.retrieve(QUERY, 4);

        assertThat(seen).containsExactly(4, 3, 4, 7);
    }

    @Test
    @DisplayName("Should fail with AnalysisUnavailable when every source fails")
    void retrieveAllSourcesFail() {
        HybridRetriever retriever = retriever(
                (q, k) -> {
                    throw new IllegalStateException("pinecone down");
                },
                (q, h, l) -> {
                    throw new IllegalStateException("neo4j down");
                },
                (p, l) -> {
                    throw new IllegalStateException("db down");
                });

        assertThatThrownBy(() -> retriever.retrieve(QUERY, 5))
                .isInstanceOf(AnalysisUnavailableException.class);
    }

    private HybridRetriever retriever(VectorDocumentIndex vector,
                                      GraphDocumentIndex graph,
                                      RelationalDocumentIndex relational) {
        return new HybridRetriever(vector, graph, relational, properties, DIRECT);
    }
}
