package com.helix.scopecheck.configuration;

import com.helix.scopecheck.budget.ModelProfile;
import com.helix.scopecheck.budget.ModelProfileResolver;
import com.helix.scopecheck.client.HttpModelInvocationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the model invoker once at startup. The judge receives it by injection, so tests pass
 * a scripted invoker instead.
 */
@Slf4j
@Configuration
public class ModelClientConfig {

    @Bean
    public HttpModelInvocationClient modelInvocationClient(WebClient.Builder builder,
                                                           AppProperties properties,
                                                           ModelProfileResolver profileResolver) {
        ModelProfile profile = profileResolver.resolve();
        String modelId = properties.getAlignment().getModelId();
        log.info("Model invoker: {} via {} (profile={}, context={}, output={})", modelId,
                properties.getModelService().getBaseUrl(), profile.name(), profile.contextTokens(), profile.outputTokens());
        return new HttpModelInvocationClient(builder, properties.getModelService(), modelId, profile.outputTokens());
    }
}
