package com.helix.scopecheck.budget;

/**
 * Tokenizer-free token estimate. Sub-word tokenizers average about 4 characters per token on
 * English text; 3.5 over-counts slightly so budgets err on the safe side.
 */
public final class TokenEstimator {

    static final double CHARS_PER_TOKEN = 3.5;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, (int) Math.ceil(text.length() / CHARS_PER_TOKEN));
    }

    static int maxChars(int tokens) {
        return (int) Math.floor(tokens * CHARS_PER_TOKEN);
    }
}
