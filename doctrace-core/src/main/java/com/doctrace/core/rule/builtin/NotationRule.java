package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.List;

/**
 * Requires a diagram to open with one of the keywords listed in {@code checks.mermaidType}.
 * Markdown assets are ignored.
 */
public class NotationRule extends AbstractRule {

    public NotationRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        List<String> keywords = definition.checks().mermaidType();
        if (asset == null || !asset.isDiagram() || keywords.isEmpty()) {
            return List.of();
        }
        if (RuleSupport.opensWithAny(asset, keywords)) {
            return List.of();
        }
        return List.of("Must use diagram notation " + RuleSupport.quotedList(keywords)
            + ". Found: \"" + RuleSupport.openingLine(asset) + "\"");
    }
}
