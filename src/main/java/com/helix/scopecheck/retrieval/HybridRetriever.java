package com.helix.scopecheck.retrieval;

import com.google.common.base.Preconditions;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.configuration.RetrievalProperties;
import com.helix.scopecheck.exception.AnalysisUnavailableException;
import com.helix.scopecheck.model.retrieval.EvidenceChunk;
import com.helix.scopecheck.model.retrieval.EvidenceChunk.ChunkKey;
import com.helix.scopecheck.model.retrieval.GraphHit;
import com.helix.scopecheck.model.retrieval.RelationalHit;
import com.helix.scopecheck.model.retrieval.RetrievalQuery;
import com.helix.scopecheck.model.retrieval.RetrievalResult;
import com.helix.scopecheck.model.retrieval.RetrievalSource;
import com.helix.scopecheck.model.retrieval.VectorHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Fans a query out to the vector, graph and relational indexes and merges their results into
 * one deduplicated ranking of evidence chunks.
 *
 * <p>Scores are normalized within each source's own result set:
 * <ul>
 *   <li>vector: min-max (all equal gives 1.0)</li>
 *   <li>graph: {@code 1 - distance / maxDistance}; no graph hit gives no graph credit</li>
 *   <li>relational: {@code (n - rank) / n} with rank 0 for the most recently approved</li>
 * </ul>
 * The combined score is the weighted mean of the three components. A chunk returned by several
 * sources is fused into one (best score, smallest distance, best rank) before scoring.
 */
@Slf4j
@Service
public class HybridRetriever {

    static final Comparator<EvidenceChunk> RANKING = Comparator
            .comparingDouble(EvidenceChunk::combinedScore).reversed()
            .thenComparing(EvidenceChunk::graphDistance, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(EvidenceChunk::sourceDocId)
            .thenComparing(EvidenceChunk::text);

    private final VectorDocumentIndex vectorIndex;
    private final GraphDocumentIndex graphIndex;
    private final RelationalDocumentIndex relationalIndex;
    private final RetrievalProperties props;
    private final Executor executor;

    public HybridRetriever(VectorDocumentIndex vectorIndex,
                           GraphDocumentIndex graphIndex,
                           RelationalDocumentIndex relationalIndex,
                           AppProperties appProperties,
                           @Qualifier("fanOutExecutor") Executor executor) {
        this.vectorIndex = vectorIndex;
        this.graphIndex = graphIndex;
        this.relationalIndex = relationalIndex;
        this.props = appProperties.getRetrieval();
        this.executor = executor;
        Preconditions.checkArgument(props.getVectorWeight() + props.getGraphWeight() + props.getRelationalWeight() > 0,
                "At least one retrieval weight must be positive");
    }

    /**
     * Runs the three lookups concurrently and merges what comes back. A failing source is
     * recorded as degraded and the others are still used.
     *
     * @throws AnalysisUnavailableException if every source fails
     */
    public RetrievalResult retrieve(RetrievalQuery query, int topK) {
        log.info("Hybrid retrieval: project='{}', paths={}, modules={}, topK={}",
                query.projectId(), query.changedPaths().size(), query.moduleNames().size(), topK);

        CompletableFuture<List<VectorHit>> vector =
                lookup(() -> vectorIndex.search(query, topK));
        CompletableFuture<List<GraphHit>> graph =
                lookup(() -> graphIndex.traverse(query, props.getMaxHops(), topK));
        CompletableFuture<List<RelationalHit>> relational =
                lookup(() -> relationalIndex.findApproved(query.projectId(), props.getRelationalLimit()));

        Set<RetrievalSource> degraded = EnumSet.noneOf(RetrievalSource.class);
        List<VectorHit> vectorHits = await(vector, RetrievalSource.VECTOR, degraded);
        List<GraphHit> graphHits = await(graph, RetrievalSource.GRAPH, degraded);
        List<RelationalHit> relationalHits = await(relational, RetrievalSource.RELATIONAL, degraded);

        if (degraded.size() == RetrievalSource.values().length) {
            log.error("All retrieval sources failed for project '{}'", query.projectId());
            throw new AnalysisUnavailableException("All retrieval sources failed; design evidence is unavailable", 0);
        }

        List<EvidenceChunk> merged = merge(vectorHits, graphHits, relationalHits);
        if (merged.isEmpty()) {
            log.info("No approved design documents found for project '{}'", query.projectId());
        } else {
            log.info("Retrieved {} evidence chunks (vector={}, graph={}, relational={}, degraded={})",
                    merged.size(), vectorHits.size(), graphHits.size(), relationalHits.size(), degraded);
        }
        return new RetrievalResult(merged, degraded);
    }

    /**
     * Pure merge of raw source results: normalize, fuse duplicates, score and sort.
     * Running it twice on the same input yields the same sequence.
     */
    public List<EvidenceChunk> merge(List<VectorHit> vectorHits,
                                     List<GraphHit> graphHits,
                                     List<RelationalHit> relationalHits) {
        Map<ChunkKey, Fused> fused = new LinkedHashMap<>();

        for (VectorHit hit : vectorHits) {
            fused.computeIfAbsent(new ChunkKey(hit.sourceDocId(), hit.text()), k -> new Fused()).vector(hit.score());
        }
        for (GraphHit hit : graphHits) {
            fused.computeIfAbsent(new ChunkKey(hit.sourceDocId(), hit.text()), k -> new Fused()).graph(hit.distance());
        }
        int rank = 0;
        for (RelationalHit hit : relationalHits) {
            Fused f = fused.computeIfAbsent(new ChunkKey(hit.sourceDocId(), hit.text()), k -> new Fused());
            if (f.relationalRank == null) {
                f.relationalRank = rank++;
            }
        }
        int relationalCount = rank;

        double minVector = Double.MAX_VALUE;
        double maxVector = -Double.MAX_VALUE;
        int maxDistance = 0;
        for (Fused f : fused.values()) {
            if (f.vectorScore != null) {
                minVector = Math.min(minVector, f.vectorScore);
                maxVector = Math.max(maxVector, f.vectorScore);
            }
            if (f.graphDistance != null) {
                maxDistance = Math.max(maxDistance, f.graphDistance);
            }
        }

        double weightSum = props.getVectorWeight() + props.getGraphWeight() + props.getRelationalWeight();
        List<EvidenceChunk> chunks = new ArrayList<>(fused.size());
        for (Map.Entry<ChunkKey, Fused> entry : fused.entrySet()) {
            Fused f = entry.getValue();

            Double vectorScore = null;
            double vectorComponent = 0.0;
            if (f.vectorScore != null) {
                vectorScore = maxVector > minVector ? (f.vectorScore - minVector) / (maxVector - minVector) : 1.0;
                vectorComponent = vectorScore;
            }
            double graphComponent = 0.0;
            if (f.graphDistance != null) {
                graphComponent = maxDistance == 0 ? 1.0 : 1.0 - (double) f.graphDistance / maxDistance;
            }
            double relationalComponent = 0.0;
            if (f.relationalRank != null) {
                relationalComponent = (double) (relationalCount - f.relationalRank) / relationalCount;
            }

            double combined = (props.getVectorWeight() * vectorComponent
                    + props.getGraphWeight() * graphComponent
                    + props.getRelationalWeight() * relationalComponent) / weightSum;

            chunks.add(new EvidenceChunk(entry.getKey().sourceDocId(), entry.getKey().text(),
                    vectorScore, f.graphDistance, f.relationalRank, clamp(combined)));
        }
        chunks.sort(RANKING);
        return List.copyOf(chunks);
    }

    private <T> CompletableFuture<List<T>> lookup(Supplier<List<T>> call) {
        try {
            return CompletableFuture.supplyAsync(call, executor)
                    .orTimeout(props.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            // saturated pool; the source is reported degraded like any other failure
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> List<T> await(CompletableFuture<List<T>> future,
                                     RetrievalSource source,
                                     Set<RetrievalSource> degraded) {
        try {
            List<T> hits = future.join();
            return hits == null ? List.of() : hits;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Retrieval source {} failed, continuing without it: {}", source, cause.toString());
            degraded.add(source);
            return List.of();
        }
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static final class Fused {
        private Double vectorScore;
        private Integer graphDistance;
        private Integer relationalRank;

        void vector(double score) {
            vectorScore = vectorScore == null ? score : Math.max(vectorScore, score);
        }

        void graph(int distance) {
            graphDistance = graphDistance == null ? distance : Math.min(graphDistance, distance);
        }
    }
}
