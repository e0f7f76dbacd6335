package com.helix.scopecheck.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PineconeProperties {

    private String apiKey;

    @NotBlank
    private String indexName = "design-docs";

    private String namespace = "";
}
