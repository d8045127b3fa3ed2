package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for mindmaps.
 *
 * <p>Hierarchy is expressed by indentation: every node becomes a child of the nearest
 * preceding node with smaller indentation and a parent-to-child relationship is recorded.
 * A node's identifier is the explicit id before its shape ({@code GOAL_Speed((Fast))}),
 * or its text when no shape is used. Decoration lines ({@code ::icon(...)}, {@code :::class})
 * are skipped. A root written as {@code root} is treated as anonymous: it anchors the
 * hierarchy but is not reported.
 */
public class MindmapAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANONYMOUS_ROOT = "root";
    private static final int TAB_WIDTH = 4;

    private static final Pattern SHAPED = Pattern.compile(
        "^([\\w-]+)\\s*(\\(\\(|\\)\\)|\\{\\{|\\[|\\(|\\))(.*)$");
    private static final Pattern UNNAMED_SHAPE = Pattern.compile("^(?:\\(\\(|\\)\\)|\\{\\{|\\[|\\(|\\))(.*?)(?:\\)\\)|\\(\\(|}}|]|\\)|\\()$");

    private record Level(int indent, String id) {
    }

    @Override
    public String getId() {
        return "mindmap-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Mindmap Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.MINDMAP;
    }

    @Override
    protected boolean preservesIndentation() {
        return true;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        Deque<Level> stack = new ArrayDeque<>();
        for (String line : lines) {
            String text = line.trim();
            if (text.startsWith("::") || text.equals(NotationType.MINDMAP.keywords().get(0))) {
                continue;
            }
            String id = identifier(text);
            if (id == null || id.isBlank()) {
                continue;
            }
            int indent = indentation(line);
            while (!stack.isEmpty() && stack.peek().indent() >= indent) {
                stack.pop();
            }
            boolean anonymous = stack.isEmpty() && ANONYMOUS_ROOT.equals(id);
            if (!anonymous) {
                builder.node(id);
                Level parent = stack.peek();
                if (parent != null && parent.id() != null) {
                    builder.relationship(parent.id(), id, null);
                }
            }
            stack.push(new Level(indent, anonymous ? null : id));
        }
    }

    private String identifier(String text) {
        String withoutClass = text.replaceAll(":::.*$", "").trim();
        Matcher shaped = matchLine(SHAPED, withoutClass);
        if (shaped != null) {
            return shaped.group(1);
        }
        Matcher unnamed = matchLine(UNNAMED_SHAPE, withoutClass);
        if (unnamed != null) {
            return cleanQuotes(unnamed.group(1));
        }
        return cleanQuotes(withoutClass);
    }

    private static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }
}
