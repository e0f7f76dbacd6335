package com.helix.scopecheck.util;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * GitHub Actions style path globs: {@code *} matches within a segment, {@code **} across
 * segments, {@code ?} one character. Patterns starting with {@code !} are exclusions.
 */
public final class PathGlobMatcher {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private PathGlobMatcher() {
    }

    /**
     * True if {@code path} matches at least one inclusion glob and the last matching glob is not
     * an exclusion (GitHub evaluates filters in order).
     */
    public static boolean matchesAny(List<String> globs, String path) {
        if (globs == null || globs.isEmpty() || path == null) {
            return false;
        }
        boolean matched = false;
        for (String glob : globs) {
            if (glob == null || glob.isBlank()) {
                continue;
            }
            if (glob.startsWith("!")) {
                if (matched && matches(glob.substring(1), path)) {
                    matched = false;
                }
            } else if (matches(glob, path)) {
                matched = true;
            }
        }
        return matched;
    }

    public static boolean matches(String glob, String path) {
        return CACHE.computeIfAbsent(glob.trim(), PathGlobMatcher::compile).matcher(path).matches();
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                if (doubleStar) {
                    boolean slashFollows = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                    // "**/" also matches zero directories
                    regex.append(slashFollows ? "(?:.*/)?" : ".*");
                    i += slashFollows ? 3 : 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }
}
