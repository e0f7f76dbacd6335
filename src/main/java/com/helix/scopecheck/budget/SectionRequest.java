package com.helix.scopecheck.budget;

import com.google.common.base.Preconditions;

/**
 * A named prompt section asking for tokens.
 *
 * @param name section name, e.g. {@code diff_summary}
 * @param priority allocation priority
 * @param naturalTokens estimated size of the untrimmed content; the section never gets more
 * @param floorTokens part of the content that must not be trimmed, honored like a fixed section
 */
public record SectionRequest(String name, SectionPriority priority, int naturalTokens, int floorTokens) {

    public SectionRequest {
        Preconditions.checkArgument(name != null && !name.isBlank(), "Section name is required");
        Preconditions.checkNotNull(priority, "priority");
        Preconditions.checkArgument(naturalTokens >= 0, "naturalTokens must be >= 0");
        Preconditions.checkArgument(floorTokens >= 0 && floorTokens <= naturalTokens,
                "floorTokens must be within [0, naturalTokens] for section %s", name);
    }

    public static SectionRequest fixed(String name, int tokens) {
        return new SectionRequest(name, SectionPriority.FIXED, tokens, tokens);
    }

    public static SectionRequest weighted(String name, SectionPriority priority, int naturalTokens) {
        return new SectionRequest(name, priority, naturalTokens, 0);
    }

    public static SectionRequest withFloor(String name, SectionPriority priority, int naturalTokens, int floorTokens) {
        return new SectionRequest(name, priority, naturalTokens, floorTokens);
    }

    /**
     * Tokens that must be reserved before weighted distribution starts.
     */
    int guaranteedTokens() {
        return priority == SectionPriority.FIXED ? naturalTokens : floorTokens;
    }
}
