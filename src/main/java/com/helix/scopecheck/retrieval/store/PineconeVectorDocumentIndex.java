package com.helix.scopecheck.retrieval.store;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.helix.scopecheck.client.EmbeddingClient;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.configuration.PineconeProperties;
import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.retrieval.RetrievalQuery;
import com.helix.scopecheck.model.retrieval.VectorHit;
import com.helix.scopecheck.retrieval.VectorDocumentIndex;
import com.helix.scopecheck.util.ExternalCallLogger;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Vector similarity over design-document chunks stored in Pinecone.
 *
 * <p>Each vector carries {@code project_id}, {@code doc_id} and {@code text} metadata; the query
 * is filtered to the check's project.
 */
@Slf4j
@Component
public class PineconeVectorDocumentIndex implements VectorDocumentIndex {

    static final String PROJECT_ID = "project_id";
    static final String DOC_ID = "doc_id";
    static final String TEXT = "text";

    private final PineconeProperties props;
    private final EmbeddingClient embeddingClient;
    private volatile Pinecone client;

    public PineconeVectorDocumentIndex(AppProperties appProperties, EmbeddingClient embeddingClient) {
        this.props = appProperties.getPinecone();
        this.embeddingClient = embeddingClient;
    }

    @Override
    public List<VectorHit> search(RetrievalQuery query, int topK) {
        String text = query.searchText();
        if (text.isBlank()) {
            log.debug("Empty search text, skipping vector lookup");
            return List.of();
        }
        List<Float> vector = embeddingClient.embed(text);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Query", log);
        ctx.logRequest("Similarity search", "index", props.getIndexName(), "project", query.projectId(), "topK", topK);
        try {
            QueryResponseWithUnsignedIndices response = client().getIndexConnection(props.getIndexName())
                    .query(
                            topK,
                            vector,
                            null,   // sparse indices
                            null,   // sparse values
                            null,   // query by id
                            props.getNamespace(),
                            projectFilter(query.projectId()),
                            false,  // include values
                            true    // include metadata
                    );

            List<VectorHit> hits = new ArrayList<>();
            if (response.getMatchesList() != null) {
                for (ScoredVectorWithUnsignedIndices match : response.getMatchesList()) {
                    toHit(match).ifPresent(hits::add);
                }
            }
            ctx.logResponse("Matches received", "matches", hits.size());
            return hits;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }

    private Optional<VectorHit> toHit(ScoredVectorWithUnsignedIndices match) {
        if (match.getMetadata() == null) {
            return Optional.empty();
        }
        Map<String, Value> fields = match.getMetadata().getFieldsMap();
        if (!fields.containsKey(TEXT)) {
            log.debug("Skipping vector {} without text metadata", match.getId());
            return Optional.empty();
        }
        String docId = fields.containsKey(DOC_ID) ? fields.get(DOC_ID).getStringValue() : match.getId();
        return Optional.of(new VectorHit(docId, fields.get(TEXT).getStringValue(), match.getScore()));
    }

    /**
     * {@code {"project_id": {"$eq": projectId}}}
     */
    private Struct projectFilter(String projectId) {
        if (projectId == null || projectId.isEmpty()) {
            return null;
        }
        return Struct.newBuilder()
                .putFields(PROJECT_ID, Value.newBuilder()
                        .setStructValue(Struct.newBuilder()
                                .putFields("$eq", Value.newBuilder().setStringValue(projectId).build())
                                .build())
                        .build())
                .build();
    }

    private Pinecone client() {
        Pinecone current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = new Pinecone.Builder(props.getApiKey()).build();
                    client = current;
                }
            }
        }
        return current;
    }
}
