package com.helix.scopecheck.budget;

/**
 * How the model should be asked to decode its answer.
 */
public enum DecodingMode {
    /** Plain text generation, schema only described in the prompt. */
    FREE_FORM,
    /** Output restricted to the verdict JSON schema by the invocation service. */
    SCHEMA_CONSTRAINED
}
