package com.helix.scopecheck.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for comparing two branches of a repository under the workspace directory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocalScopeCheckRequest {

    @NotBlank(message = "Repository path is required")
    private String repoPath;

    @NotBlank(message = "Base branch is required")
    private String baseBranch;

    /** Optional; the repository's current branch when omitted. */
    private String headBranch;

    @NotBlank(message = "Project id is required")
    private String projectId;

    private String description;
}
