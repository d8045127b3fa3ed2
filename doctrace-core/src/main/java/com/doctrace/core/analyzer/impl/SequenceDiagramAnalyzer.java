package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for sequence diagrams.
 *
 * <p>Participants come from {@code participant} and {@code actor} declarations, where the
 * token before {@code as} is the identifier. Participants used in a message without being
 * declared are added in first-seen order. Every message becomes a relationship labelled
 * with its message text.
 *
 * <p><b>Supported arrows:</b> {@code ->}, {@code -->}, {@code ->>}, {@code -->>},
 * {@code -x}, {@code --x}, {@code -)}, {@code --)}, {@code <<->>}, {@code <<-->>}
 */
public class SequenceDiagramAnalyzer extends AbstractRegexAnalyzer {

    private static final Pattern PARTICIPANT = Pattern.compile(
        "^(?:create\\s+)?(?:participant|actor)\\s+([^\\s@]+)(?:@\\{.*})?(?:\\s+as\\s+(.+))?$");

    private static final Pattern MESSAGE = Pattern.compile(
        "^([^\\s:<>+]+?)\\s*(<<-->>|<<->>|-->>|->>|-->|->|--x|-x|--\\)|-\\))\\s*[+-]?\\s*([^\\s:<>+]+)\\s*(?::(.*))?$");

    private static final List<String> IGNORED = List.of(
        "autonumber", "note", "loop", "alt", "else", "opt", "par", "and", "critical", "option",
        "break", "rect", "end", "box", "activate", "deactivate", "destroy", "title", "links", "link");

    @Override
    public String getId() {
        return "sequence-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Sequence Diagram Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.SEQUENCE;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        for (String line : lines) {
            Matcher participant = matchLine(PARTICIPANT, line);
            if (participant != null) {
                builder.node(cleanQuotes(participant.group(1)));
                continue;
            }
            if (startsWithKeyword(line, IGNORED)) {
                continue;
            }
            Matcher message = matchLine(MESSAGE, line);
            if (message != null) {
                builder.link(message.group(1), message.group(3), extractGroup(message, 4));
            }
        }
    }
}
