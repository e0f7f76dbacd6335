package com.helix.scopecheck.model.prompt;

import com.helix.scopecheck.budget.DecodingMode;

import java.util.List;
import java.util.Map;

/**
 * The judge prompt for one check.
 *
 * @param text full prompt payload
 * @param decodingMode free-form or schema-constrained decoding
 * @param templateName instruction template the payload was built from
 * @param sectionOrder sections present in the payload, in order
 * @param sectionTokens estimated tokens per section
 * @param droppedEvidence evidence chunks left out for budget reasons
 * @param repairTokens tokens reserved for a repair instruction appended on retries
 */
public record AssembledPrompt(String text,
                              DecodingMode decodingMode,
                              String templateName,
                              List<String> sectionOrder,
                              Map<String, Integer> sectionTokens,
                              int droppedEvidence,
                              int repairTokens) {

    public AssembledPrompt {
        sectionOrder = List.copyOf(sectionOrder);
        sectionTokens = Map.copyOf(sectionTokens);
    }
}
