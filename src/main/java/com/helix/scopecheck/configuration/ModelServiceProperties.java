package com.helix.scopecheck.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Connection settings of the model invocation service.
 */
@Data
public class ModelServiceProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8090";

    private String apiKey;

    @NotBlank
    private String invokePath = "/v1/invoke";

    @NotBlank
    private String embedPath = "/v1/embed";

    @Min(1)
    private int connectTimeoutMs = 10_000;

    @Min(1)
    private int responseTimeoutSeconds = 180;

    private double temperature = 0.0;
}
