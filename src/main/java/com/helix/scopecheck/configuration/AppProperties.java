package com.helix.scopecheck.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank(message = "Workspace directory path is required")
    private String workspaceDir;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AlignmentProperties alignment = new AlignmentProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private RetrievalProperties retrieval = new RetrievalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SummaryProperties summary = new SummaryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ModelServiceProperties modelService = new ModelServiceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private PineconeProperties pinecone = new PineconeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private BitbucketProperties bitbucket = new BitbucketProperties();
}
