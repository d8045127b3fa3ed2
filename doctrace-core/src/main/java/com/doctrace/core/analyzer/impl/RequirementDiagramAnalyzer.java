package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for requirement diagrams.
 *
 * <p>Nodes are the names of requirement blocks ({@code requirement}, {@code functionalRequirement},
 * {@code designConstraint}, ...) and {@code element} blocks, plus any {@code id:} value declared
 * inside a block. Relationships are labelled with their relation type; the reverse form
 * {@code dest <- type - src} is normalized to {@code src -> dest}.
 */
public class RequirementDiagramAnalyzer extends AbstractRegexAnalyzer {

    private static final Pattern BLOCK = Pattern.compile(
        "^(requirement|functionalRequirement|interfaceRequirement|performanceRequirement|physicalRequirement"
            + "|designConstraint|element)\\s+(\"[^\"]+\"|[\\w-]+)\\s*\\{(.*)$");
    private static final Pattern ID_FIELD = Pattern.compile("(?:^|[\\s{;])id\\s*:\\s*(\"[^\"]*\"|[\\w.-]+)");
    private static final Pattern FORWARD = Pattern.compile(
        "^(\"[^\"]+\"|[\\w-]+)\\s*-\\s*(\\w+)\\s*->\\s*(\"[^\"]+\"|[\\w-]+)$");
    private static final Pattern REVERSE = Pattern.compile(
        "^(\"[^\"]+\"|[\\w-]+)\\s*<-\\s*(\\w+)\\s*-\\s*(\"[^\"]+\"|[\\w-]+)$");

    @Override
    public String getId() {
        return "requirement-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Requirement Diagram Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.REQUIREMENT;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        boolean inBlock = false;
        for (String line : lines) {
            if (inBlock) {
                collectId(line, builder);
                if (line.contains("}")) {
                    inBlock = false;
                }
                continue;
            }
            Matcher block = matchLine(BLOCK, line);
            if (block != null) {
                builder.node(cleanQuotes(block.group(2)));
                String rest = block.group(3);
                collectId(rest, builder);
                inBlock = !rest.contains("}");
                continue;
            }
            Matcher forward = matchLine(FORWARD, line);
            if (forward != null) {
                builder.link(cleanQuotes(forward.group(1)), cleanQuotes(forward.group(3)), forward.group(2));
                continue;
            }
            Matcher reverse = matchLine(REVERSE, line);
            if (reverse != null) {
                builder.link(cleanQuotes(reverse.group(3)), cleanQuotes(reverse.group(1)), reverse.group(2));
            }
        }
    }

    private void collectId(String text, DiagramAnalysis.Builder builder) {
        Matcher id = findFirst(ID_FIELD, text);
        if (id != null) {
            builder.node(cleanQuotes(id.group(1)));
        }
    }
}
