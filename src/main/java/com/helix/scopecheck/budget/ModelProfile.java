package com.helix.scopecheck.budget;

import com.google.common.base.Preconditions;

/**
 * Context-window profile of the active model.
 *
 * @param name profile name ({@code standard} or {@code small})
 * @param contextTokens effective context window
 * @param outputTokens allowance reserved for the model's answer
 * @param retrievalTopK evidence chunks requested per retrieval source
 * @param fewShotEnabled whether few-shot examples may be included
 * @param constrainedDecoding whether to request schema-constrained decoding
 * @param smallModel whether the profile targets a small model (simplified instructions)
 */
public record ModelProfile(String name,
                           int contextTokens,
                           int outputTokens,
                           int retrievalTopK,
                           boolean fewShotEnabled,
                           boolean constrainedDecoding,
                           boolean smallModel) {

    public ModelProfile {
        Preconditions.checkArgument(contextTokens > outputTokens,
                "Profile %s: context (%s) must exceed output allowance (%s)", name, contextTokens, outputTokens);
        Preconditions.checkArgument(retrievalTopK > 0, "retrievalTopK must be positive");
    }

    /**
     * Prompt budget: context window minus the reserved output allowance.
     */
    public int inputTokens() {
        return contextTokens - outputTokens;
    }

    public DecodingMode decodingMode() {
        return constrainedDecoding ? DecodingMode.SCHEMA_CONSTRAINED : DecodingMode.FREE_FORM;
    }
}
