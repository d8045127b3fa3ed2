package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for class diagrams.
 *
 * <p>Classes come from {@code class} declarations and relationship endpoints. Members inside
 * a class body are ignored. Relationships are recorded left to right as written.
 */
public class ClassDiagramAnalyzer extends AbstractRegexAnalyzer {

    private static final Pattern CLASS_DECL = Pattern.compile("^class\\s+([\\w-]+)(?:~[^~]*~)?(?:\\[[^]]*])?\\s*(\\{.*)?$");
    private static final Pattern RELATIONSHIP = Pattern.compile(
        "^([\\w-]+)\\s*(?:\"[^\"]*\"\\s*)?(<\\|--|\\*--|o--|-->|--\\*|--o|--\\|>|\\.\\.>|\\.\\.\\|>|<\\|\\.\\.|<\\.\\.|<--|--|\\.\\.)"
            + "\\s*(?:\"[^\"]*\"\\s*)?([\\w-]+)\\s*(?::(.*))?$");

    private static final List<String> IGNORED = List.of(
        "note", "direction", "classDef", "style", "cssClass", "callback", "click", "link", "namespace");

    @Override
    public String getId() {
        return "class-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Class Diagram Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.CLASS;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        boolean inBody = false;
        for (String line : lines) {
            if (inBody) {
                if (line.contains("}")) {
                    inBody = false;
                }
                continue;
            }
            Matcher declaration = matchLine(CLASS_DECL, line);
            if (declaration != null) {
                builder.node(declaration.group(1));
                String body = extractGroup(declaration, 2);
                inBody = body != null && !body.contains("}");
                continue;
            }
            if (line.equals("}") || startsWithKeyword(line, IGNORED)) {
                continue;
            }
            Matcher relationship = matchLine(RELATIONSHIP, line);
            if (relationship != null) {
                builder.link(relationship.group(1), relationship.group(3), extractGroup(relationship, 4));
            }
        }
    }
}
