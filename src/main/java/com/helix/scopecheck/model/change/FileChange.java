package com.helix.scopecheck.model.change;

import java.util.List;
import java.util.Objects;

/**
 * A changed file with its ordered hunks.
 *
 * @param path path on the head side (old path for deletions)
 * @param changeKind added, modified, deleted or renamed
 * @param previousPath path on the base side for renames, otherwise {@code null}
 * @param hunks ordered hunks, possibly empty (binary files, pure renames)
 */
public record FileChange(String path, ChangeKind changeKind, String previousPath, List<Hunk> hunks) {

    public FileChange {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(changeKind, "changeKind");
        hunks = hunks == null ? List.of() : List.copyOf(hunks);
    }

    public static FileChange of(String path, ChangeKind kind, List<Hunk> hunks) {
        return new FileChange(path, kind, null, hunks);
    }

    public int addedLines() {
        return countLines('+');
    }

    public int removedLines() {
        return countLines('-');
    }

    private int countLines(char marker) {
        String fileHeader = String.valueOf(marker).repeat(3);
        int count = 0;
        for (Hunk hunk : hunks) {
            for (String line : hunk.text().split("\n", -1)) {
                if (!line.isEmpty() && line.charAt(0) == marker && !line.startsWith(fileHeader)) {
                    count++;
                }
            }
        }
        return count;
    }
}
