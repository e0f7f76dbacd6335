package com.helix.scopecheck.model.verdict;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared most severe first; the ordinal is the report order.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Severity> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.name().equals(normalized)).findFirst();
    }
}
