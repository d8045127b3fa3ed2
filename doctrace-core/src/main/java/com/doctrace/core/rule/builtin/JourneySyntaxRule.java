package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Journeys are sequence diagrams tracing to a persona.
 */
public class JourneySyntaxRule extends AbstractRule {

    private static final String SEQUENCE = "sequenceDiagram";

    public JourneySyntaxRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null || !asset.isDiagram()) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        if (!RuleSupport.opensWithAny(asset, List.of(SEQUENCE))) {
            errors.add("Journeys must use \"sequenceDiagram\" notation.");
        }
        if (asset.frontMatter().hasId()) {
            context.node(asset.id())
                .filter(node -> !node.hasUplinkWithPrefix(RuleSupport.PERSONA))
                .ifPresent(node -> errors.add("Journey \"" + node.id() + "\" must trace to a persona (uplink: PER_...)."));
        }
        return errors;
    }
}
