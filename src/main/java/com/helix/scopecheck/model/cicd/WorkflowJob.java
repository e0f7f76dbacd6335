package com.helix.scopecheck.model.cicd;

import java.util.List;

/**
 * A job of a CI/CD workflow with its ordered step descriptors.
 */
public record WorkflowJob(String name, String runsOn, List<String> steps) {

    public WorkflowJob {
        steps = steps == null ? List.of() : List.copyOf(steps);
        runsOn = runsOn == null ? "unknown" : runsOn;
    }
}
