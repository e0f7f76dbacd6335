package com.helix.scopecheck.model.cicd;

import com.helix.scopecheck.util.PathGlobMatcher;

import java.util.List;

/**
 * Parsed CI/CD workflow definition. Read-only evidence for the diff summary.
 *
 * @param name workflow display name
 * @param file workflow file path relative to the repository root
 * @param triggerEvents event names from the {@code on:} block
 * @param pathGlobs file-path globs the workflow triggers on; empty when unfiltered
 * @param jobs jobs in declaration order
 */
public record WorkflowSpec(String name,
                           String file,
                           List<String> triggerEvents,
                           List<String> pathGlobs,
                           List<WorkflowJob> jobs) {

    public WorkflowSpec {
        triggerEvents = triggerEvents == null ? List.of() : List.copyOf(triggerEvents);
        pathGlobs = pathGlobs == null ? List.of() : List.copyOf(pathGlobs);
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public List<String> jobNames() {
        return jobs.stream().map(WorkflowJob::name).toList();
    }

    /**
     * Whether {@code path} is explicitly referenced by one of this workflow's path globs.
     * Workflows without path filters reference nothing explicitly.
     */
    public boolean references(String path) {
        return PathGlobMatcher.matchesAny(pathGlobs, path);
    }
}
