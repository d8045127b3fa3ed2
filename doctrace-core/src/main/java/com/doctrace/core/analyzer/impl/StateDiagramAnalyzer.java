package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for state diagrams ({@code stateDiagram} and {@code stateDiagram-v2}).
 *
 * <p>States are declared by {@code state "Label" as ID}, {@code state ID}, {@code ID : description}
 * or by appearing in a transition. The pseudo-state {@code [*]} is kept as a relationship
 * endpoint but never reported as a node.
 */
public class StateDiagramAnalyzer extends AbstractRegexAnalyzer {

    static final String TERMINAL = "[*]";

    private static final Pattern STATE_ALIAS = Pattern.compile("^state\\s+\"[^\"]*\"\\s+as\\s+([\\w-]+).*$");
    private static final Pattern STATE_DECL = Pattern.compile("^state\\s+([\\w-]+).*$");
    private static final Pattern TRANSITION = Pattern.compile(
        "^(\\[\\*]|[\\w-]+)\\s*-->\\s*(\\[\\*]|[\\w-]+)\\s*(?::(.*))?$");
    private static final Pattern DESCRIPTION = Pattern.compile("^([\\w-]+)\\s*:\\s*.*$");

    private static final List<String> IGNORED = List.of(
        "note", "end", "direction", "classDef", "class", "style", "--", "}");

    @Override
    public String getId() {
        return "state-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "State Diagram Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.STATE;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        for (String line : lines) {
            Matcher alias = matchLine(STATE_ALIAS, line);
            if (alias != null) {
                builder.node(alias.group(1));
                continue;
            }
            Matcher declaration = matchLine(STATE_DECL, line);
            if (declaration != null) {
                builder.node(declaration.group(1));
                continue;
            }
            if (line.equals("--") || line.equals("}") || startsWithKeyword(line, IGNORED)) {
                continue;
            }
            Matcher transition = matchLine(TRANSITION, line);
            if (transition != null) {
                String from = transition.group(1);
                String to = transition.group(2);
                state(builder, from);
                state(builder, to);
                builder.relationship(from, to, extractGroup(transition, 3));
                continue;
            }
            Matcher description = matchLine(DESCRIPTION, line);
            if (description != null) {
                builder.node(description.group(1));
            }
        }
    }

    private static void state(DiagramAnalysis.Builder builder, String id) {
        if (!TERMINAL.equals(id)) {
            builder.node(id);
        }
    }
}
