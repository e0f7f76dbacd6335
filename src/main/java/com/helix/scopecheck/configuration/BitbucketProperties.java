package com.helix.scopecheck.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class BitbucketProperties {

    @NotBlank
    private String baseUrl = "https://api.bitbucket.org/2.0";

    private String workspace;

    private String appPassword;

    /**
     * Post the report on the pull request when a pull request check finds violations.
     */
    private boolean commentOnViolations = true;
}
