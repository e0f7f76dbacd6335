package com.helix.scopecheck.exception;

import lombok.Getter;

import java.util.List;

/**
 * Model output that failed parsing, schema or invariant validation.
 */
@Getter
public class MalformedModelOutputException extends ScopeCheckException {

    private final List<String> problems;

    public MalformedModelOutputException(List<String> problems) {
        super(ErrorCategory.MODEL_MALFORMED_OUTPUT, "Malformed model output: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
