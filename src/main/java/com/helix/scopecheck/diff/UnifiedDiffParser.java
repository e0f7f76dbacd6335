package com.helix.scopecheck.diff;

import com.helix.scopecheck.model.change.ChangeKind;
import com.helix.scopecheck.model.change.FileChange;
import com.helix.scopecheck.model.change.Hunk;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code git diff} unified output into {@link FileChange}s.
 *
 * <p>Hunk ranges are taken from the new side of the {@code @@} header; hunks of deleted files
 * (empty new side) use the old side.
 *
 * <p>Paths git writes in C-style quotes ({@code "a/caf\303\251.py"}) are unquoted, with octal
 * escapes decoded as UTF-8 bytes.
 */
public final class UnifiedDiffParser {

    private static final String FILE_HEADER_PREFIX = "diff --git ";
    private static final Pattern UNQUOTED_HEADER = Pattern.compile("^a/(.+) b/(.+)$");
    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$");
    private static final String DEV_NULL = "/dev/null";

    private UnifiedDiffParser() {
    }

    public static List<FileChange> parse(String diffText) {
        List<FileChange> files = new ArrayList<>();
        if (diffText == null || diffText.isBlank()) {
            return files;
        }

        FileBuilder current = null;
        HunkBuilder hunk = null;
        for (String line : diffText.split("\r?\n", -1)) {
            if (line.startsWith(FILE_HEADER_PREFIX)) {
                if (current != null) {
                    current.close(hunk);
                    files.add(current.build());
                }
                current = FileBuilder.fromHeader(line.substring(FILE_HEADER_PREFIX.length()));
                hunk = null;
                continue;
            }
            if (current == null) {
                continue;
            }
            Matcher hunkMatcher = HUNK_HEADER.matcher(line);
            if (hunkMatcher.matches()) {
                current.close(hunk);
                hunk = new HunkBuilder(hunkMatcher, line);
                continue;
            }
            if (hunk != null) {
                appendBodyLine(hunk, line);
                continue;
            }
            current.header(line);
        }
        if (current != null) {
            current.close(hunk);
            files.add(current.build());
        }
        return files;
    }

    /**
     * Reads only the hunks of a diff that covers a single file; header lines are skipped.
     */
    public static List<Hunk> parseHunks(String fileDiffText) {
        List<Hunk> hunks = new ArrayList<>();
        if (fileDiffText == null || fileDiffText.isBlank()) {
            return hunks;
        }
        HunkBuilder hunk = null;
        for (String line : fileDiffText.split("\r?\n", -1)) {
            Matcher hunkMatcher = HUNK_HEADER.matcher(line);
            if (hunkMatcher.matches()) {
                if (hunk != null) {
                    hunks.add(hunk.build());
                }
                hunk = new HunkBuilder(hunkMatcher, line);
            } else if (hunk != null) {
                appendBodyLine(hunk, line);
            }
        }
        if (hunk != null) {
            hunks.add(hunk.build());
        }
        return hunks;
    }

    /**
     * Unquotes a path git wrote in C-style quotes. Unquoted input is returned unchanged.
     */
    static String unquote(String path) {
        if (path.length() < 2 || path.charAt(0) != '"' || path.charAt(path.length() - 1) != '"') {
            return path;
        }
        return decodeQuoted(path, 1, path.length() - 1);
    }

    private static void appendBodyLine(HunkBuilder hunk, String line) {
        if (line.startsWith("+") || line.startsWith("-") || line.startsWith(" ") || line.startsWith("\\")) {
            hunk.append(line);
        }
    }

    /**
     * Splits the {@code a/<old> b/<new>} part of a {@code diff --git} line. Either side may be quoted.
     * Returns {@code null} when the line has neither shape.
     */
    private static String[] splitHeaderPaths(String rest) {
        if (rest.startsWith("\"")) {
            int close = closingQuote(rest, 0);
            if (close < 0 || close + 2 > rest.length()) {
                return null;
            }
            String oldPath = decodeQuoted(rest, 1, close);
            String newPath = unquote(rest.substring(close + 2));
            return new String[]{oldPath, newPath};
        }
        if (rest.endsWith("\"")) {
            int open = rest.lastIndexOf(" \"");
            if (open < 0) {
                return null;
            }
            return new String[]{rest.substring(0, open), unquote(rest.substring(open + 1))};
        }
        Matcher matcher = UNQUOTED_HEADER.matcher(rest);
        if (!matcher.matches()) {
            return null;
        }
        return new String[]{"a/" + matcher.group(1), "b/" + matcher.group(2)};
    }

    private static int closingQuote(String text, int open) {
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    private static String decodeQuoted(String text, int from, int to) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= to) {
                byte[] encoded = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                bytes.write(encoded, 0, encoded.length);
                i++;
                continue;
            }
            char next = text.charAt(i + 1);
            if (next >= '0' && next <= '7') {
                int end = i + 1;
                int value = 0;
                while (end < to && end < i + 4 && text.charAt(end) >= '0' && text.charAt(end) <= '7') {
                    value = value * 8 + (text.charAt(end) - '0');
                    end++;
                }
                bytes.write(value & 0xFF);
                i = end;
                continue;
            }
            bytes.write(escaped(next));
            i += 2;
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static int escaped(char c) {
        switch (c) {
            case 'a':
                return 0x07;
            case 'b':
                return '\b';
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'v':
                return 0x0B;
            case 'f':
                return '\f';
            case 'r':
                return '\r';
            default:
                return c;
        }
    }

    private static String stripPrefix(String path, String prefix) {
        return path.startsWith(prefix) ? path.substring(prefix.length()) : path;
    }

    private static final class FileBuilder {
        private String oldPath;
        private String newPath;
        private ChangeKind kind = ChangeKind.MODIFIED;
        private final List<Hunk> hunks = new ArrayList<>();

        private FileBuilder(String oldPath, String newPath) {
            this.oldPath = oldPath;
            this.newPath = newPath;
        }

        static FileBuilder fromHeader(String rest) {
            String[] paths = splitHeaderPaths(rest);
            if (paths == null) {
                // resolved later from the ---/+++ or rename lines
                return new FileBuilder(rest, rest);
            }
            return new FileBuilder(stripPrefix(paths[0], "a/"), stripPrefix(paths[1], "b/"));
        }

        void header(String line) {
            if (line.startsWith("new file mode")) {
                kind = ChangeKind.ADDED;
            } else if (line.startsWith("deleted file mode")) {
                kind = ChangeKind.DELETED;
            } else if (line.startsWith("rename from ")) {
                oldPath = unquote(line.substring("rename from ".length()));
                kind = ChangeKind.RENAMED;
            } else if (line.startsWith("rename to ")) {
                newPath = unquote(line.substring("rename to ".length()));
                kind = ChangeKind.RENAMED;
            } else if (line.startsWith("--- ")) {
                String path = unquote(line.substring(4));
                if (path.equals(DEV_NULL)) {
                    kind = ChangeKind.ADDED;
                } else if (path.startsWith("a/")) {
                    oldPath = path.substring(2);
                }
            } else if (line.startsWith("+++ ")) {
                String path = unquote(line.substring(4));
                if (path.equals(DEV_NULL)) {
                    kind = ChangeKind.DELETED;
                } else if (path.startsWith("b/")) {
                    newPath = path.substring(2);
                }
            }
        }

        void close(HunkBuilder hunk) {
            if (hunk != null) {
                hunks.add(hunk.build());
            }
        }

        FileChange build() {
            if (kind == ChangeKind.MODIFIED && !oldPath.equals(newPath)) {
                kind = ChangeKind.RENAMED;
            }
            // deleted files are reported under the path they had
            String path = kind == ChangeKind.DELETED ? oldPath : newPath;
            String previous = kind == ChangeKind.RENAMED ? oldPath : null;
            return new FileChange(path, kind, previous, hunks);
        }
    }

    private static final class HunkBuilder {
        private final int start;
        private final int end;
        private final StringBuilder text = new StringBuilder();

        HunkBuilder(Matcher header, String headerLine) {
            int oldStart = Integer.parseInt(header.group(1));
            int oldCount = count(header.group(2));
            int newStart = Integer.parseInt(header.group(3));
            int newCount = count(header.group(4));
            if (newCount == 0 && oldCount > 0) {
                start = oldStart;
                end = oldStart + oldCount - 1;
            } else {
                start = newStart;
                end = newStart + Math.max(newCount, 1) - 1;
            }
            text.append(headerLine);
        }

        void append(String line) {
            text.append('\n').append(line);
        }

        Hunk build() {
            return new Hunk(start, end, text.toString());
        }

        private static int count(String group) {
            return group == null ? 1 : Integer.parseInt(group);
        }
    }
}
