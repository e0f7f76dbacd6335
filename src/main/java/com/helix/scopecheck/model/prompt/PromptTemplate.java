package com.helix.scopecheck.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: scope-check
 * version: 1.2
 * description: Judge a change against approved design evidence
 * systemPrompt: |
 *   You are a design-alignment reviewer...
 * userPrompt: |
 *   Review the change below...
 * fewShotExamples: |
 *   Example 1 ...
 * </pre>
 *
 * Text is rendered with Mustache; use triple braces for values that must not be HTML-escaped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
    private String fewShotExamples;
}
