package com.helix.scopecheck.model.summary;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bounded structural summary of a change.
 *
 * <p>{@link #renderHeader()} is the part that is never trimmed (branch line, full file inventory,
 * flags, CI block); the excerpts are ranked and may be dropped from the end.
 */
public record DiffSummary(String branchTitle,
                          int commitCount,
                          List<FileInventoryEntry> inventory,
                          List<HunkExcerpt> excerpts,
                          Set<DiffFlag> flags,
                          String ciSummary,
                          int elidedHunks) {

    public DiffSummary {
        inventory = List.copyOf(inventory);
        excerpts = List.copyOf(excerpts);
        flags = Set.copyOf(flags);
        ciSummary = ciSummary == null ? "" : ciSummary;
    }

    public boolean has(DiffFlag flag) {
        return flags.contains(flag);
    }

    public String renderHeader() {
        StringBuilder sb = new StringBuilder();
        if (branchTitle != null && !branchTitle.isBlank()) {
            sb.append("Branch: ").append(branchTitle).append(" (").append(commitCount).append(" commits)\n");
        }
        sb.append("Changed files (").append(inventory.size()).append("):\n");
        inventory.forEach(e -> sb.append(e.render()).append('\n'));

        String flagLine = flags.stream()
                .sorted()
                .map(DiffFlag::label)
                .collect(Collectors.joining(", "));
        sb.append("Flags: ").append(flagLine.isEmpty() ? "none" : flagLine).append('\n');

        if (!ciSummary.isEmpty()) {
            sb.append(ciSummary).append('\n');
        }
        sb.append("Hunk excerpts:");
        return sb.toString();
    }

    public String render() {
        StringBuilder sb = new StringBuilder(renderHeader());
        excerpts.forEach(e -> sb.append('\n').append(e.render()));
        return sb.toString();
    }
}
