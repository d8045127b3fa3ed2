package com.doctrace.core.analyzer;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Diagram grammar families understood by the analyzer set.
 *
 * <p>Each family declares the opening keywords that select it. Detection looks at the first
 * token of the diagram after any front-matter block and {@code %%} comment lines have been removed.
 */
public enum NotationType {
    /** Flowchart / graph notation ({@code graph TD}, {@code flowchart LR}) */
    FLOWCHART("flowchart", List.of("flowchart", "graph")),

    /** Sequence notation */
    SEQUENCE("sequence", List.of("sequenceDiagram")),

    /** State-machine notation */
    STATE("state", List.of("stateDiagram-v2", "stateDiagram")),

    /** Entity-relationship notation */
    ENTITY_RELATIONSHIP("er", List.of("erDiagram")),

    /** Hierarchical mindmap notation */
    MINDMAP("mindmap", List.of("mindmap")),

    /** Requirement notation */
    REQUIREMENT("requirement", List.of("requirementDiagram")),

    /** C4-style notation with parenthesized call syntax */
    C4("c4", List.of("C4Context", "C4Container", "C4Component", "C4Dynamic", "C4Deployment")),

    /** Class notation */
    CLASS("class", List.of("classDiagram", "classDiagram-v2")),

    /** Anything not recognized */
    UNKNOWN("unknown", List.of());

    private static final Pattern FRONT_MATTER = Pattern.compile("\\A\\s*---\\R.*?\\R---[ \\t]*(?:\\R|\\z)", Pattern.DOTALL);
    private static final Pattern FIRST_TOKEN = Pattern.compile("^([A-Za-z0-9_-]+)");

    private final String id;
    private final List<String> keywords;

    NotationType(String id, List<String> keywords) {
        this.id = id;
        this.keywords = keywords;
    }

    /**
     * Short stable id stored in cache entries (e.g. "sequence").
     *
     * @return notation id
     */
    public String id() {
        return id;
    }

    /**
     * Opening keywords that select this notation.
     *
     * @return keywords, empty for {@link #UNKNOWN}
     */
    public List<String> keywords() {
        return keywords;
    }

    /**
     * Resolves a notation from a diagram's opening keyword, ignoring case. The longest
     * declared keyword that prefixes the given token wins ({@code flowchart-elk} is a flowchart).
     *
     * @param keyword first token of the diagram
     * @return matching notation or {@link #UNKNOWN}
     */
    public static NotationType fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return UNKNOWN;
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        NotationType best = UNKNOWN;
        int bestLength = 0;
        for (NotationType type : values()) {
            for (String candidate : type.keywords) {
                String lowered = candidate.toLowerCase(Locale.ROOT);
                if (normalized.startsWith(lowered) && lowered.length() > bestLength) {
                    best = type;
                    bestLength = lowered.length();
                }
            }
        }
        return best;
    }

    /**
     * Resolves a notation from its stored id.
     *
     * @param id notation id as returned by {@link #id()}
     * @return matching notation or {@link #UNKNOWN}
     */
    public static NotationType fromId(String id) {
        for (NotationType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * Detects the notation of raw diagram text.
     *
     * @param content raw file content, possibly with front matter
     * @return detected notation or {@link #UNKNOWN}
     */
    public static NotationType detect(String content) {
        return fromKeyword(openingKeyword(content));
    }

    /**
     * Returns the first token of the diagram body, or an empty string.
     *
     * @param content raw file content, possibly with front matter
     * @return opening keyword as written
     */
    public static String openingKeyword(String content) {
        String cleaned = stripPreamble(content);
        Matcher matcher = FIRST_TOKEN.matcher(cleaned);
        return matcher.find() ? matcher.group(1) : "";
    }

    /**
     * Removes a leading front-matter block and {@code %%} comment lines, then trims.
     *
     * @param content raw file content
     * @return diagram text starting at its opening keyword
     */
    public static String stripPreamble(String content) {
        if (content == null) {
            return "";
        }
        String body = FRONT_MATTER.matcher(content).replaceFirst("");
        StringBuilder kept = new StringBuilder();
        for (String line : body.split("\\R", -1)) {
            if (!line.trim().startsWith("%%")) {
                kept.append(line).append('\n');
            }
        }
        return kept.toString().trim();
    }
}
