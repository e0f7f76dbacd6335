package com.helix.scopecheck.judge;

import com.helix.scopecheck.model.CancellationToken;
import com.helix.scopecheck.model.prompt.AssembledPrompt;

import java.util.Objects;
import java.util.Set;

/**
 * @param fileInventory paths every violation must refer to (or be project-wide)
 * @param noEvidence whether retrieval found no approved design for the project
 */
public record JudgeRequest(AssembledPrompt prompt,
                           Set<String> fileInventory,
                           boolean noEvidence,
                           CancellationToken cancellation) {

    public JudgeRequest {
        Objects.requireNonNull(prompt, "prompt");
        fileInventory = Set.copyOf(fileInventory);
        cancellation = cancellation == null ? CancellationToken.none() : cancellation;
    }
}
