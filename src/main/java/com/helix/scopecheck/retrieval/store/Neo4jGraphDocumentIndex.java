package com.helix.scopecheck.retrieval.store;

import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.retrieval.GraphHit;
import com.helix.scopecheck.model.retrieval.RetrievalQuery;
import com.helix.scopecheck.retrieval.GraphDocumentIndex;
import com.helix.scopecheck.util.ExternalCallLogger;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bounded traversal in the design knowledge graph.
 *
 * <p>Graph shape: {@code (:CodePath {projectId, path})} and {@code (:Module {projectId, name})}
 * nodes linked, directly or through intermediate nodes, to {@code (:DocChunk {projectId, docId, text})}.
 * The distance of a chunk is the length of the shortest path from any matched start node.
 */
@Slf4j
@Component
public class Neo4jGraphDocumentIndex implements GraphDocumentIndex {

    private static final String TRAVERSAL = """
            MATCH (start)
            WHERE start.projectId = $projectId
              AND ((start:CodePath AND start.path IN $paths) OR (start:Module AND start.name IN $modules))
            MATCH p = (start)-[*1..%d]-(chunk:DocChunk)
            WHERE chunk.projectId = $projectId
            WITH chunk, min(length(p)) AS distance
            RETURN chunk.docId AS docId, chunk.text AS text, distance
            ORDER BY distance ASC, docId ASC
            LIMIT $limit
            """;

    @Value("${neo4j.uri:bolt://localhost:7687}")
    private String neo4jUri;

    @Value("${neo4j.username:neo4j}")
    private String neo4jUsername;

    @Value("${neo4j.password:password}")
    private String neo4jPassword;

    private Driver driver;

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j design graph at: {}", neo4jUri);
        driver = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = driver.session()) {
            session.run("CREATE INDEX code_path IF NOT EXISTS FOR (c:CodePath) ON (c.projectId, c.path)");
            session.run("CREATE INDEX module_name IF NOT EXISTS FOR (m:Module) ON (m.projectId, m.name)");
            session.run("CREATE INDEX doc_chunk_project IF NOT EXISTS FOR (d:DocChunk) ON (d.projectId)");
        } catch (Neo4jException e) {
            // graph lookups degrade per check while the database is unreachable
            log.warn("Could not create Neo4j indexes at startup: {}", e.getMessage());
        }
    }

    @Override
    public List<GraphHit> traverse(RetrievalQuery query, int maxHops, int limit) {
        if (query.changedPaths().isEmpty() && query.moduleNames().isEmpty()) {
            return List.of();
        }
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, "TraverseDesignGraph", log);
        ctx.logRequest("Traversal from changed code", "project", query.projectId(),
                "paths", query.changedPaths().size(), "modules", query.moduleNames().size(), "maxHops", maxHops);

        try (Session session = driver.session()) {
            List<GraphHit> hits = session.run(String.format(TRAVERSAL, Math.max(1, maxHops)), Values.parameters(
                            "projectId", query.projectId(),
                            "paths", query.changedPaths(),
                            "modules", query.moduleNames(),
                            "limit", limit))
                    .list(record -> new GraphHit(
                            record.get("docId").asString(),
                            record.get("text").asString(""),
                            record.get("distance").asInt()));
            ctx.logResponse("Traversal complete", "hits", hits.size());
            return hits;
        } catch (Neo4jException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        }
    }
}
