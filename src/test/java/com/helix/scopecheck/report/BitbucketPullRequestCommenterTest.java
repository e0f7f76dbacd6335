package com.helix.scopecheck.report;

import com.helix.scopecheck.configuration.AppProperties;
import com.helix.scopecheck.exception.RepoUnavailableException;
import com.helix.scopecheck.model.change.RepoRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Bitbucket Pull Request Commenter Tests")
class BitbucketPullRequestCommenterTest {

    private static final RepoRef REPO = new RepoRef("payments");

    private AppProperties properties;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.setWorkspaceDir("/tmp/workspace");
        properties.getBitbucket().setWorkspace("helix");
        properties.getBitbucket().setAppPassword("token");
    }

    @Test
    @DisplayName("Should post the report to the pull request comments endpoint")
    void postsComment() {
        // Given
        BitbucketPullRequestCommenter commenter = commenter(HttpStatus.CREATED, "{\"id\": 991}");

        // When
        commenter.comment(REPO, 42, "## Scope Check Report");

        // Then
        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/2.0/repositories/helix/payments/pullrequests/42/comments", request.url().getPath());
        assertEquals("Bearer token", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("Should report the repository unavailable when Bitbucket rejects the comment")
    void mapsApiErrors() {
        BitbucketPullRequestCommenter commenter = commenter(HttpStatus.FORBIDDEN, "{\"error\": {}}");

        RepoUnavailableException e = assertThrows(RepoUnavailableException.class,
                () -> commenter.comment(REPO, 42, "report"));

        assertThat(e.getMessage()).contains("pull request #42");
    }

    @Test
    @DisplayName("Should not call Bitbucket when comments are disabled and fail when unconfigured")
    void disabledAndUnconfigured() {
        properties.getBitbucket().setCommentOnViolations(false);
        commenter(HttpStatus.CREATED, "{}").comment(REPO, 42, "report");
        assertThat(requests).isEmpty();

        properties.getBitbucket().setCommentOnViolations(true);
        properties.getBitbucket().setWorkspace("");
        BitbucketPullRequestCommenter unconfigured = commenter(HttpStatus.CREATED, "{}");
        assertThrows(RepoUnavailableException.class, () -> unconfigured.comment(REPO, 42, "report"));
        assertThat(requests).isEmpty();
    }

    private BitbucketPullRequestCommenter commenter(HttpStatus status, String body) {
        return new BitbucketPullRequestCommenter(WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        }), properties);
    }
}
