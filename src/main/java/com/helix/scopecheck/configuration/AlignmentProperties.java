package com.helix.scopecheck.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the alignment judge and the token budget.
 *
 * <pre>
 * app:
 *   alignment:
 *     approval-threshold: 0.6
 *     max-retries: 2
 *     model-id: qwen2.5-7b-instruct
 *     profile: ""            # "small" or "standard" forces a profile
 *     small-model-patterns:
 *       - "qwen.*7b"
 *     profiles:
 *       small:
 *         context-tokens: 6144
 *         output-tokens: 2048
 * </pre>
 */
@Data
public class AlignmentProperties {

    /**
     * Scores below this value require approval even without critical violations.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double approvalThreshold = 0.6;

    /**
     * Repair cycles allowed after the first model attempt.
     */
    @Min(0)
    private int maxRetries = 2;

    /**
     * Characters of the previous malformed output echoed into a repair prompt.
     */
    @Min(100)
    private int repairEchoChars = 2000;

    @NotBlank
    private String modelId = "gpt-4o";

    /**
     * Explicit profile name; blank means detect from {@link #modelId}.
     */
    private String profile = "";

    /**
     * Case-insensitive regexes; a model id matching one of them selects the small profile.
     */
    private List<String> smallModelPatterns = new ArrayList<>(List.of(
            "qwen.*7b", "llama.*8b", "phi-?3", "mistral.*7b", "gemma.*(2b|7b)"));

    @Valid
    private Profiles profiles = new Profiles();

    @Valid
    private SectionWeights sectionWeights = new SectionWeights();

    @Data
    public static class Profiles {

        @Valid
        private ProfileProperties standard = ProfileProperties.standard();

        @Valid
        private ProfileProperties small = ProfileProperties.small();
    }

    @Data
    public static class ProfileProperties {

        @Min(512)
        private int contextTokens;

        @Min(64)
        private int outputTokens;

        @Min(1)
        private int retrievalTopK;

        private boolean fewShotEnabled;

        private boolean constrainedDecoding;

        static ProfileProperties standard() {
            ProfileProperties p = new ProfileProperties();
            p.setContextTokens(128_000);
            p.setOutputTokens(4_096);
            p.setRetrievalTopK(8);
            p.setFewShotEnabled(true);
            p.setConstrainedDecoding(false);
            return p;
        }

        static ProfileProperties small() {
            ProfileProperties p = new ProfileProperties();
            p.setContextTokens(6_144);
            p.setOutputTokens(2_048);
            p.setRetrievalTopK(3);
            p.setFewShotEnabled(false);
            p.setConstrainedDecoding(true);
            return p;
        }
    }

    /**
     * Relative weights used when distributing tokens between non-fixed sections.
     */
    @Data
    public static class SectionWeights {

        @Min(1)
        private int high = 3;

        @Min(1)
        private int medium = 2;

        @Min(1)
        private int low = 1;
    }
}
