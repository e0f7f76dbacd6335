package com.helix.scopecheck.budget;

import java.util.List;

/**
 * Result of fitting a ranked list into a section budget.
 *
 * @param kept items that fit, in rank order
 * @param text rendered section text (header followed by the kept items)
 * @param dropped number of lowest-ranked items dropped wholesale
 * @param truncated whether the single top item had to be cut as a last resort
 */
public record RankedFit<T>(List<T> kept, String text, int dropped, boolean truncated) {
}
