package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for flowcharts ({@code graph} and {@code flowchart}).
 *
 * <p>Statements are tokenized into node references and links rather than matched as a whole,
 * so chains ({@code A --> B --> C}), inline shapes ({@code A[Start] --> B{Check}}) and
 * {@code &} groups ({@code A & B --> C}) are all understood. Link text may be written as
 * {@code -->|text|} or {@code -- text -->}. Structural statements such as {@code subgraph},
 * {@code classDef} and {@code style} are skipped.
 */
public class FlowchartAnalyzer extends AbstractRegexAnalyzer {

    private static final Pattern NODE_ID = Pattern.compile("[A-Za-z0-9_]+(?:[-.][A-Za-z0-9_]+)*");
    private static final Pattern LINK = Pattern.compile(
        "\\s*(<?(?:-{2,}[->ox]?|-\\.+->?|={2,}[=>ox]?|~{3,})|<?-\\.+-)\\s*(?:\\|([^|]*)\\|)?\\s*");
    private static final Pattern TEXT_LINK = Pattern.compile(
        "(\\s)(--|==|-\\.)\\s+([^|>\\-=.][^>]*?)\\s+(-{2,}>|={2,}>|\\.->|-{3,}|={3,})(\\s)");

    private static final List<String> IGNORED = List.of(
        "subgraph", "end", "classDef", "class", "style", "linkStyle", "click", "direction", "accTitle", "accDescr");

    @Override
    public String getId() {
        return "flowchart-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Flowchart Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.FLOWCHART;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        for (String line : lines) {
            for (String statement : line.split(";")) {
                String trimmed = statement.trim();
                if (trimmed.isEmpty() || startsWithKeyword(trimmed, IGNORED)) {
                    continue;
                }
                parseStatement(normalizeTextLinks(trimmed), builder);
            }
        }
    }

    private String normalizeTextLinks(String statement) {
        Matcher matcher = TEXT_LINK.matcher(" " + statement + " ");
        return matcher.replaceAll("$1$4|$3|$5").trim();
    }

    private void parseStatement(String statement, DiagramAnalysis.Builder builder) {
        int[] position = {0};
        List<String> previous = readGroup(statement, position);
        if (previous.isEmpty()) {
            return;
        }
        previous.forEach(builder::node);
        while (position[0] < statement.length()) {
            Matcher link = LINK.matcher(statement);
            link.region(position[0], statement.length());
            if (!link.lookingAt()) {
                return;
            }
            String label = extractGroup(link, 2);
            position[0] = link.end();
            List<String> next = readGroup(statement, position);
            if (next.isEmpty()) {
                return;
            }
            for (String from : previous) {
                for (String to : next) {
                    builder.link(from, to, label == null ? null : cleanQuotes(label));
                }
            }
            previous = next;
        }
    }

    // reads "A", "A[..]" or "A & B[..]", advancing position past the group
    private List<String> readGroup(String statement, int[] position) {
        List<String> ids = new ArrayList<>();
        while (true) {
            skipWhitespace(statement, position);
            Matcher id = NODE_ID.matcher(statement);
            id.region(position[0], statement.length());
            if (!id.lookingAt()) {
                return ids;
            }
            ids.add(id.group());
            position[0] = id.end();
            skipShape(statement, position);
            skipClassSuffix(statement, position);
            skipWhitespace(statement, position);
            if (position[0] < statement.length() && statement.charAt(position[0]) == '&') {
                position[0]++;
                continue;
            }
            return ids;
        }
    }

    private static void skipShape(String statement, int[] position) {
        if (position[0] >= statement.length()) {
            return;
        }
        char open = statement.charAt(position[0]);
        if (open == '>') {
            int close = statement.indexOf(']', position[0]);
            position[0] = close < 0 ? statement.length() : close + 1;
            return;
        }
        if (open == '@' && position[0] + 1 < statement.length() && statement.charAt(position[0] + 1) == '{') {
            position[0]++;
            open = '{';
        }
        if (open != '[' && open != '(' && open != '{') {
            return;
        }
        int depth = 0;
        boolean quoted = false;
        for (int i = position[0]; i < statement.length(); i++) {
            char c = statement.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && (c == '[' || c == '(' || c == '{')) {
                depth++;
            } else if (!quoted && (c == ']' || c == ')' || c == '}')) {
                depth--;
                if (depth == 0) {
                    position[0] = i + 1;
                    return;
                }
            }
        }
        position[0] = statement.length();
    }

    private static void skipClassSuffix(String statement, int[] position) {
        if (statement.startsWith(":::", position[0])) {
            int i = position[0] + 3;
            while (i < statement.length() && isIdentifierChar(statement.charAt(i))) {
                i++;
            }
            position[0] = i;
        }
    }

    private static void skipWhitespace(String statement, int[] position) {
        while (position[0] < statement.length() && Character.isWhitespace(statement.charAt(position[0]))) {
            position[0]++;
        }
    }
}
