package com.helix.scopecheck.budget;

import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token allocation for one check. Created by {@link TokenBudgetManager#allocate}, mutated only
 * through the manager, discarded after prompt assembly.
 *
 * <p>Invariants: {@code used(s) <= reserved(s)} for every section, and the reservations never
 * sum to more than {@link #totalTokens()}.
 */
public final class Budget {

    private final int totalTokens;
    private final Map<String, Integer> reserved;
    private final Map<String, Integer> used = new LinkedHashMap<>();
    private final DecodingMode decodingMode;
    private final boolean fewShotEnabled;

    Budget(int totalTokens, Map<String, Integer> reserved, DecodingMode decodingMode, boolean fewShotEnabled) {
        int sum = reserved.values().stream().mapToInt(Integer::intValue).sum();
        Preconditions.checkState(sum <= totalTokens, "Reserved %s tokens exceeds total %s", sum, totalTokens);
        this.totalTokens = totalTokens;
        this.reserved = Collections.unmodifiableMap(new LinkedHashMap<>(reserved));
        this.decodingMode = decodingMode;
        this.fewShotEnabled = fewShotEnabled;
        reserved.keySet().forEach(section -> used.put(section, 0));
    }

    public int totalTokens() {
        return totalTokens;
    }

    public Map<String, Integer> reserved() {
        return reserved;
    }

    public Map<String, Integer> used() {
        return Collections.unmodifiableMap(used);
    }

    public int reserved(String section) {
        return reserved.getOrDefault(section, 0);
    }

    public int used(String section) {
        return used.getOrDefault(section, 0);
    }

    public int totalReserved() {
        return reserved.values().stream().mapToInt(Integer::intValue).sum();
    }

    public DecodingMode decodingMode() {
        return decodingMode;
    }

    public boolean fewShotEnabled() {
        return fewShotEnabled;
    }

    void recordUsage(String section, int tokens) {
        Preconditions.checkArgument(reserved.containsKey(section), "Unknown budget section: %s", section);
        Preconditions.checkArgument(tokens >= 0, "tokens must be >= 0");
        Preconditions.checkState(tokens <= reserved(section),
                "Section %s uses %s tokens but only %s are reserved", section, tokens, reserved(section));
        used.put(section, tokens);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        reserved.forEach((section, tokens) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(section).append('=').append(used(section)).append('/').append(tokens);
        });
        return "total=" + totalTokens + ", reserved=" + totalReserved() + " | " + sb;
    }
}
