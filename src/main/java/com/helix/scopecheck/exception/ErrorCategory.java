package com.helix.scopecheck.exception;

/**
 * Failure taxonomy of a scope check.
 */
public enum ErrorCategory {
    /** Missing refs, unknown repository, unparseable workflow files. Never retried. */
    INPUT_ERROR,
    /** Fixed prompt sections alone overflow the context. Never retried. */
    BUDGET_EXCEEDED,
    /** A retrieval source failed; the check continued with lower confidence. */
    RETRIEVAL_DEGRADED,
    /** Model output failed validation; handled by the repair loop. */
    MODEL_MALFORMED_OUTPUT,
    /** Terminal model failure or exhausted repairs. No score is produced. */
    ANALYSIS_UNAVAILABLE
}
