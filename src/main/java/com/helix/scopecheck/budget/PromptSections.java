package com.helix.scopecheck.budget;

/**
 * Section names of the judge prompt, in payload order.
 */
public final class PromptSections {

    public static final String SYSTEM_INSTRUCTIONS = "system_instructions";
    public static final String OUTPUT_SCHEMA = "output_schema";
    public static final String DIFF_SUMMARY = "diff_summary";

    /**
     * Budgeted on its own, rendered at the end of the diff summary block.
     */
    public static final String REPO_MAP = "repo_map";
    public static final String RETRIEVED_CONTEXT = "retrieved_context";
    public static final String FEW_SHOT_EXAMPLES = "few_shot_examples";

    /**
     * Not rendered; held back for the correction instruction appended on repair attempts.
     */
    public static final String REPAIR_RESERVE = "repair_reserve";

    private PromptSections() {
    }
}
