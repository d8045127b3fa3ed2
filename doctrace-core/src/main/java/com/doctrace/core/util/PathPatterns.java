package com.doctrace.core.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob-style matching of forward-slash separated relative paths.
 *
 * <p>Supported syntax:
 * <ul>
 *   <li>{@code **}{@code /} matches zero or more leading directories</li>
 *   <li>{@code **} matches any characters, separators included</li>
 *   <li>{@code *} matches any characters except {@code /}</li>
 *   <li>{@code ?} matches one character except {@code /}</li>
 *   <li>{@code {a,b}} matches either alternative</li>
 * </ul>
 * The whole path must match.
 */
public final class PathPatterns {

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    private PathPatterns() {
        // Utility class
    }

    /**
     * Tests a relative path against a glob.
     *
     * @param glob glob pattern, e.g. {@code personas/*} or {@code **}{@code /*.{mermaid,md}}
     * @param relativePath forward-slash separated path
     * @return true if the whole path matches
     */
    public static boolean matches(String glob, String relativePath) {
        if (glob == null || glob.isBlank() || relativePath == null) {
            return false;
        }
        return COMPILED.computeIfAbsent(glob, PathPatterns::compile).matcher(relativePath).matches();
    }

    /**
     * Converts a glob to an anchored regular expression.
     *
     * @param glob glob pattern
     * @return compiled pattern
     */
    public static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder("^");
        int braceDepth = 0;
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                if (doubleStar && i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                    regex.append("(?:.*/)?");
                    i += 3;
                    continue;
                }
                if (doubleStar) {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if (c == '{') {
                braceDepth++;
                regex.append("(?:");
            } else if (c == '}' && braceDepth > 0) {
                braceDepth--;
                regex.append(')');
            } else if (c == ',' && braceDepth > 0) {
                regex.append('|');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.append('$').toString());
    }

    /**
     * Returns the literal directory a folder pattern governs, e.g. {@code personas/*} gives
     * {@code personas}. Returns an empty string when the pattern starts with a wildcard.
     *
     * @param glob folder pattern
     * @return literal folder path without trailing wildcards
     */
    public static String literalFolder(String glob) {
        if (glob == null) {
            return "";
        }
        int wildcard = indexOfWildcard(glob);
        String literal = wildcard < 0 ? glob : glob.substring(0, wildcard);
        if (wildcard >= 0) {
            int slash = literal.lastIndexOf('/');
            literal = slash >= 0 ? literal.substring(0, slash) : "";
        }
        while (literal.endsWith("/")) {
            literal = literal.substring(0, literal.length() - 1);
        }
        return literal;
    }

    private static int indexOfWildcard(String glob) {
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?' || c == '{') {
                return i;
            }
        }
        return -1;
    }
}
