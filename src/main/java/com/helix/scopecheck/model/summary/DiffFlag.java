package com.helix.scopecheck.model.summary;

import java.util.Locale;

public enum DiffFlag {
    HAS_CI_TRIGGER,
    HAS_TEST_FILE_CHANGE,
    HAS_CI_CONFIG_CHANGE,
    HAS_DEPENDENCY_MANIFEST_CHANGE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
