package com.doctrace.core.analyzer.base;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for analyzers that recognize statements with regular expressions.
 *
 * <p>Provides match and group helpers plus small string utilities for cleaning labels and
 * identifiers extracted from diagram text.
 *
 * @see AbstractDiagramAnalyzer
 */
public abstract class AbstractRegexAnalyzer extends AbstractDiagramAnalyzer {

    protected AbstractRegexAnalyzer() {
        super();
    }

    /**
     * Finds all matches of a compiled pattern in the given text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return match results in order
     */
    protected List<MatchResult> findMatches(Pattern pattern, String text) {
        List<MatchResult> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.toMatchResult());
        }
        return matches;
    }

    /**
     * Matches the whole statement against a pattern.
     *
     * @param pattern compiled regex pattern
     * @param line statement line
     * @return matcher if the whole line matches, null otherwise
     */
    protected Matcher matchLine(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.matches() ? matcher : null;
    }

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Extracts a numbered group from a matcher.
     *
     * @param matcher matcher with results
     * @param groupIndex index of the capture group (1-based)
     * @return captured text, or null if group not found or did not participate
     */
    protected String extractGroup(MatchResult matcher, int groupIndex) {
        try {
            return matcher.group(groupIndex);
        } catch (IndexOutOfBoundsException | IllegalStateException e) {
            return null;
        }
    }

    /**
     * Trims whitespace and removes surrounding quotes and backticks.
     *
     * @param text text to clean
     * @return cleaned text, or null if input is null
     */
    protected String cleanQuotes(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.trim();
        boolean changed = true;
        while (changed && cleaned.length() >= 2) {
            changed = false;
            char first = cleaned.charAt(0);
            char last = cleaned.charAt(cleaned.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && first == last) {
                cleaned = cleaned.substring(1, cleaned.length() - 1).trim();
                changed = true;
            }
        }
        return cleaned;
    }

    /**
     * Checks if a statement starts with one of the given keywords followed by a boundary.
     *
     * @param line statement line
     * @param keywords keywords to check
     * @return true if the statement is introduced by a keyword
     */
    protected boolean startsWithKeyword(String line, List<String> keywords) {
        for (String keyword : keywords) {
            if (line.equals(keyword)
                || (line.startsWith(keyword) && !isIdentifierChar(line.charAt(keyword.length())))) {
                return true;
            }
        }
        return false;
    }

    protected static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
