package com.helix.scopecheck.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.configuration.BitbucketProperties;
import com.helix.scopecheck.exception.RefNotFoundException;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.change.BranchMetadata;
import com.helix.scopecheck.model.change.ChangeSet;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.util.List;

/**
 * Pull-request mode: reads PR metadata and the unified diff from the Bitbucket Cloud API.
 */
@Slf4j
@Service
public class BitbucketPullRequestDiffProvider implements PullRequestDiffProvider {

    private final WebClient webClient;
    private final BitbucketProperties props;

    public BitbucketPullRequestDiffProvider(WebClient.Builder builder, AppProperties appProperties) {
        this.props = appProperties.getBitbucket();

        WebClient.Builder configured = builder
                .baseUrl(props.getBaseUrl())
                // the diff endpoint answers with a redirect
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)));
        if (props.getAppPassword() != null && !props.getAppPassword().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getAppPassword());
        }
        this.webClient = configured.build();
    }

    @Override
    public ChangeSet getPullRequestChangeSet(RepoRef repo, long pullRequestId) {
        String workspace = props.getWorkspace();
        if (workspace == null || workspace.isBlank()) {
            throw new RepoUnavailableException("app.bitbucket.workspace is not configured");
        }
        String ref = "pull-request #" + pullRequestId;

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.BITBUCKET, "GetPullRequestDiff", log);
        ctx.logRequest("Fetching pull request", "workspace", workspace, "repo", repo, "id", pullRequestId);

        try {
            JsonNode pr = webClient.get()
                    .uri("/repositories/{workspace}/{repo}/pullrequests/{id}", workspace, repo.location(), pullRequestId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            if (pr == null) {
                throw new RefNotFoundException(repo.location(), ref);
            }

            String diff = webClient.get()
                    .uri("/repositories/{workspace}/{repo}/pullrequests/{id}/diff", workspace, repo.location(), pullRequestId)
                    .accept(MediaType.TEXT_PLAIN)
                    .retrieve()
                    .bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .block();

            List<FileChange> files = UnifiedDiffParser.parse(diff);
            String base = pr.path("destination").path("branch").path("name").asText("");
            String head = pr.path("source").path("branch").path("name").asText("");
            // the PR resource carries no commit count
            BranchMetadata metadata = new BranchMetadata(pr.path("title").asText(""), pr.path("description").asText(""), 0);

            ctx.logResponse("Pull request diff fetched", "files", files.size(), "base", base, "head", head);
            return new ChangeSet(repo, base.isEmpty() ? "destination" : base, head.isEmpty() ? ref : head, metadata, files);

        } catch (WebClientResponseException.NotFound e) {
            ctx.logError("Pull request not found", e);
            throw new RefNotFoundException(repo.location(), ref);
        } catch (WebClientException e) {
            ctx.logError("Bitbucket API error: " + e.getMessage(), e);
            throw new RepoUnavailableException("Bitbucket API error for " + repo + ": " + e.getMessage(), e);
        }
    }
}
