package com.helix.scopecheck.judge;

import com.helix.scopecheck.model.verdict.AlignmentVerdict;

import java.util.List;

/**
 * An accepted verdict with the path the state machine took to it.
 *
 * @param attempts model invocations made
 * @param repairCycles passes through {@link JudgeState#REPAIRING}
 * @param trace every state entered, in order
 */
public record JudgeOutcome(AlignmentVerdict verdict, int attempts, int repairCycles, List<JudgeState> trace) {

    public JudgeOutcome {
        trace = List.copyOf(trace);
    }
}
