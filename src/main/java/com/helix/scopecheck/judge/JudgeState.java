package com.helix.scopecheck.judge;

public enum JudgeState {
    BUILDING,
    INVOKING,
    VALIDATING,
    REPAIRING,
    ACCEPTED,
    FAILED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == FAILED;
    }
}
