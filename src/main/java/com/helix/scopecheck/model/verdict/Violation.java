package com.helix.scopecheck.model.verdict;

import java.util.Objects;

/**
 * A finding of the judge.
 *
 * @param filePath a path from the change set's file inventory, or {@code null} for a
 *                 project-wide finding
 */
public record Violation(ViolationKind kind,
                        Severity severity,
                        String filePath,
                        String description,
                        String recommendation) {

    public Violation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        description = description == null ? "" : description.strip();
        recommendation = recommendation == null ? "" : recommendation.strip();
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
