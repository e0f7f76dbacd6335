package com.helix.scopecheck.model.summary;

/**
 * A hunk selected for the summary, possibly cut to the per-hunk character cap.
 */
public record HunkExcerpt(String path,
                          int startLine,
                          int endLine,
                          String text,
                          int changedLines,
                          boolean referencedByCi,
                          boolean truncated) {

    public String render() {
        return "--- " + path + " lines " + startLine + "-" + endLine + " ---\n" + text;
    }

    public HunkExcerpt withText(String newText) {
        return new HunkExcerpt(path, startLine, endLine, newText, changedLines, referencedByCi, true);
    }
}
