package com.helix.scopecheck.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.configuration.BitbucketProperties;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.model.change.RepoRef;
import com.helix.scopecheck.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.util.Map;

/**
 * Posts the markdown report as a Bitbucket Cloud pull request comment.
 */
@Slf4j
@Service
public class BitbucketPullRequestCommenter implements PullRequestCommenter {

    private final WebClient webClient;
    private final BitbucketProperties props;

    public BitbucketPullRequestCommenter(WebClient.Builder builder, AppProperties appProperties) {
        this.props = appProperties.getBitbucket();

        WebClient.Builder configured = builder
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (props.getAppPassword() != null && !props.getAppPassword().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getAppPassword());
        }
        this.webClient = configured.build();
    }

    @Override
    public void comment(RepoRef repo, long pullRequestId, String markdown) {
        if (!props.isCommentOnViolations()) {
            log.debug("Pull request comments disabled, not commenting on #{}", pullRequestId);
            return;
        }
        String workspace = props.getWorkspace();
        if (workspace == null || workspace.isBlank()) {
            throw new RepoUnavailableException("app.bitbucket.workspace is not configured");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.BITBUCKET, "CommentPullRequest", log);
        ctx.logRequest(ExternalCallLogger.truncate(markdown, 200), "repo", repo, "id", pullRequestId);

        Map<String, Object> body = Map.of("content", Map.of("raw", markdown));
        try {
            JsonNode response = webClient.post()
                    .uri("/repositories/{workspace}/{repo}/pullrequests/{id}/comments",
                            workspace, repo.location(), pullRequestId)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            ctx.logResponse("Comment posted", "commentId", response == null ? null : response.path("id").asText(null));
        } catch (WebClientException e) {
            ctx.logError("Bitbucket API error: " + e.getMessage(), e);
            throw new RepoUnavailableException("Failed to comment on pull request #" + pullRequestId
                    + " of " + repo + ": " + e.getMessage(), e);
        }
    }
}
