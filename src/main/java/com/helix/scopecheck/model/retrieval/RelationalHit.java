package com.helix.scopecheck.model.retrieval;

import java.time.Instant;

/**
 * Raw relational match. Hits arrive ordered most-recently-approved first; the position in
 * that order is the relational rank.
 */
public record RelationalHit(String sourceDocId, String text, Instant approvedAt) {
}
