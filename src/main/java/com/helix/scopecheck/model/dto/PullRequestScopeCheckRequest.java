package com.helix.scopecheck.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for checking a Bitbucket pull request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestScopeCheckRequest {

    @NotBlank(message = "Repository slug is required")
    private String repoSlug;

    @NotNull(message = "Pull request id is required")
    @Positive
    private Long pullRequestId;

    @NotBlank(message = "Project id is required")
    private String projectId;

    private String description;
}
