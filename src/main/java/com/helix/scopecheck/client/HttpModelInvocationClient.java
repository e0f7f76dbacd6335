package com.helix.scopecheck.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.helix.scopecheck.budget.DecodingMode;
import com.helix.scopecheck.configuration.ModelServiceProperties;
import com.helix.scopecheck.exception.ModelErrorKind;
import com.helix.scopecheck.exception.ModelInvocationException;
import com.helix.scopecheck.model.CallContext;
import com.helix.scopecheck.model.ServiceType;
import com.helix.scopecheck.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Client of the model invocation service.
 *
 * <pre>
 * POST {invoke-path}  {"model", "prompt", "decoding_mode", "schema"?, "max_tokens", "temperature"}
 *                  -> {"output": "..."}
 * POST {embed-path}   {"model", "input"} -> {"embedding": [..]}
 * </pre>
 *
 * HTTP failures map to {@link ModelErrorKind}: 401/403 invalid credentials, 429 quota, 408/504
 * and client-side timeouts timeout, anything else unknown.
 */
@Slf4j
public class HttpModelInvocationClient implements ModelInvoker, EmbeddingClient {

    private final WebClient webClient;
    private final ModelServiceProperties props;
    private final String modelId;
    private final int maxOutputTokens;

    public HttpModelInvocationClient(WebClient.Builder builder,
                                     ModelServiceProperties props,
                                     String modelId,
                                     int maxOutputTokens) {
        this.props = props;
        this.modelId = modelId;
        this.maxOutputTokens = maxOutputTokens;

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, props.getConnectTimeoutMs())
                .responseTimeout(Duration.ofSeconds(props.getResponseTimeoutSeconds()));

        WebClient.Builder configured = builder
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        }
        this.webClient = configured.build();
    }

    @Override
    public String describe() {
        return modelId + " @ " + props.getBaseUrl();
    }

    @Override
    public String invoke(String prompt, String schema, DecodingMode decodingMode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelId);
        body.put("prompt", prompt);
        body.put("decoding_mode", decodingMode == DecodingMode.SCHEMA_CONSTRAINED ? "json_schema" : "free_form");
        if (decodingMode == DecodingMode.SCHEMA_CONSTRAINED) {
            body.put("schema", schema);
        }
        body.put("max_tokens", maxOutputTokens);
        body.put("temperature", props.getTemperature());

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.MODEL, "Invoke", log);
        ctx.logRequest(ExternalCallLogger.truncate(prompt, 200), "model", modelId,
                "promptChars", prompt.length(), "decoding", decodingMode);

        JsonNode response = post(props.getInvokePath(), body, ctx);
        JsonNode output = response.get("output");
        if (output == null || output.isNull()) {
            ctx.logError("Response without output field", null);
            throw new ModelInvocationException(ModelErrorKind.UNKNOWN, "Model service response has no 'output' field");
        }
        String text = output.isTextual() ? output.asText() : output.toString();
        ctx.logResponse(ExternalCallLogger.truncate(text, 500), "outputChars", text.length());
        return text;
    }

    @Override
    public List<Float> embed(String text) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.MODEL, "Embed", log);
        ctx.logRequest(null, "chars", text.length());

        JsonNode response = post(props.getEmbedPath(), Map.of("model", modelId, "input", text), ctx);
        JsonNode embedding = response.path("embedding");
        if (!embedding.isArray() || embedding.isEmpty()) {
            ctx.logError("Response without embedding", null);
            throw new ModelInvocationException(ModelErrorKind.UNKNOWN, "Embedding response has no 'embedding' array");
        }
        List<Float> vector = new ArrayList<>(embedding.size());
        embedding.forEach(v -> vector.add((float) v.asDouble()));
        ctx.logResponse(null, "dimensions", vector.size());
        return vector;
    }

    private JsonNode post(String path, Object body, CallContext ctx) {
        try {
            JsonNode response = webClient.post()
                    .uri(path)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
            if (response == null) {
                throw new ModelInvocationException(ModelErrorKind.UNKNOWN, "Empty response from model service");
            }
            return response;
        } catch (WebClientResponseException e) {
            ModelErrorKind kind = classify(e.getStatusCode().value());
            ctx.logError("HTTP " + e.getStatusCode().value() + " (" + kind + ")", e);
            throw new ModelInvocationException(kind, "Model service returned HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            ModelErrorKind kind = isTimeout(e) ? ModelErrorKind.TIMEOUT : ModelErrorKind.UNKNOWN;
            ctx.logError("Request failed (" + kind + "): " + e.getMessage(), e);
            throw new ModelInvocationException(kind, "Model service request failed: " + e.getMessage(), e);
        }
    }

    static ModelErrorKind classify(int status) {
        if (status == 401 || status == 403) {
            return ModelErrorKind.INVALID_CREDENTIALS;
        }
        if (status == 429) {
            return ModelErrorKind.QUOTA_EXCEEDED;
        }
        if (status == 408 || status == 504) {
            return ModelErrorKind.TIMEOUT;
        }
        return ModelErrorKind.UNKNOWN;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
