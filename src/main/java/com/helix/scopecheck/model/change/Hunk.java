package com.helix.scopecheck.model.change;

/**
 * One contiguous region of a unified diff.
 *
 * @param startLine first line of the region (new side, or old side for deletions)
 * @param endLine last line of the region, inclusive
 * @param text the raw hunk body including the {@code @@} header
 */
public record Hunk(int startLine, int endLine, String text) {

    public Hunk {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid hunk range " + startLine + ".." + endLine);
        }
        text = text == null ? "" : text;
    }

    public int lineSpan() {
        return endLine - startLine + 1;
    }

    /**
     * Number of added or removed lines, used to rank hunks by significance.
     */
    public int changedLineCount() {
        int count = 0;
        for (String line : text.split("\n", -1)) {
            if ((line.startsWith("+") && !line.startsWith("+++"))
                    || (line.startsWith("-") && !line.startsWith("---"))) {
                count++;
            }
        }
        return count;
    }
}
