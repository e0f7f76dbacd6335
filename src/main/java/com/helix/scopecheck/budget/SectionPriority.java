package com.helix.scopecheck.budget;

/**
 * Allocation priority of a prompt section. Fixed sections are honored in full before any
 * weighted section receives tokens.
 */
public enum SectionPriority {
    FIXED,
    HIGH,
    MEDIUM,
    LOW
}
