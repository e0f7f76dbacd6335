package com.helix.scopecheck.client;

import com.helix.scopecheck.budget.DecodingMode;

/**
 * Capability to run one prompt against the language model. One call is one opaque
 * request/response exchange; transport retries are the service's concern.
 */
public interface ModelInvoker {

    /**
     * @param schema JSON Schema of the expected output, enforced when {@code decodingMode} is
     *               {@link DecodingMode#SCHEMA_CONSTRAINED}
     * @return raw model text
     * @throws com.helix.scopecheck.exception.ModelInvocationException on any service failure
     */
    String invoke(String prompt, String schema, DecodingMode decodingMode);

    /**
     * Identifier used in logs.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
