package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for C4-style diagrams.
 *
 * <p>Elements are declared with call syntax whose first argument is the identifier, e.g.
 * {@code Person(PER_User, "User")} or {@code System_Boundary(b1, "Core")}. Relationships
 * use {@code Rel}, {@code BiRel} and the directional variants, labelled by their third argument.
 */
public class C4DiagramAnalyzer extends AbstractRegexAnalyzer {

    private static final Pattern ELEMENT = Pattern.compile(
        "^(?:Person|System|Container|Component|Node|Deployment_Node|Boundary|Enterprise_Boundary"
            + "|System_Boundary|Container_Boundary)(?:Db|Queue)?(?:_Ext)?(?:_[LR])?\\s*\\(\\s*([\\w-]+)");

    private static final Pattern RELATION = Pattern.compile(
        "^(?:Rel|BiRel|Rel_[DULR]|Rel_Up|Rel_Down|Rel_Left|Rel_Right|Rel_Back|Rel_Neighbor)\\s*\\(\\s*([\\w-]+)\\s*,"
            + "\\s*([\\w-]+)\\s*(?:,\\s*(\"[^\"]*\"|[^,)]*))?");

    @Override
    public String getId() {
        return "c4-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "C4 Diagram Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.C4;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        for (String line : lines) {
            Matcher relation = findFirst(RELATION, line);
            if (relation != null) {
                builder.link(relation.group(1), relation.group(2), cleanQuotes(extractGroup(relation, 3)));
                continue;
            }
            Matcher element = findFirst(ELEMENT, line);
            if (element != null) {
                builder.node(element.group(1));
            }
        }
    }
}
