package com.helix.scopecheck.model.verdict;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ViolationKind {
    SCOPE_CREEP,
    MISSING_FEATURE_FLAG,
    UNDOCUMENTED_DEPENDENCY,
    MISSING_TEST_COVERAGE,
    OTHER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts {@code scope_creep}, {@code scope-creep} and {@code Scope Creep}.
     */
    public static Optional<ViolationKind> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.name().equals(normalized)).findFirst();
    }
}
