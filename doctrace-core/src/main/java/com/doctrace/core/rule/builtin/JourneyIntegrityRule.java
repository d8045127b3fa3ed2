package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.NodeMetadata;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Behavioral personas (actors and proxies) and functional requirements are each covered by
 * at least one journey uplinking to them. Personas without a recorded type count as actors.
 */
public class JourneyIntegrityRule extends AbstractRule {

    private static final Set<String> BEHAVIORAL = Set.of("actor", "proxy");
    private static final String DEFAULT_TYPE = "actor";

    public JourneyIntegrityRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        Set<String> covered = new HashSet<>();
        for (GraphNode node : context.nodeMap().values()) {
            if (node.id().startsWith(RuleSupport.JOURNEY)) {
                covered.addAll(node.uplinks());
            }
        }

        List<String> errors = new ArrayList<>();
        for (GraphNode node : context.nodeMap().values()) {
            if (!context.isDeclared(node.id()) || covered.contains(node.id())
                || RuleSupport.isFootnoteId(context, node.id())) {
                continue;
            }
            if (node.id().startsWith(RuleSupport.PERSONA)) {
                String type = node.metadata().getString(NodeMetadata.PERSONA_TYPE)
                    .orElse(DEFAULT_TYPE).toLowerCase(Locale.ROOT);
                if (BEHAVIORAL.contains(type)) {
                    errors.add("Behavioral stakeholder without journey: " + RuleSupport.capitalize(type)
                        + " \"" + node.id() + "\" has no associated journey.");
                }
            } else if (node.id().startsWith(RuleSupport.REQUIREMENT) && RuleSupport.isFunctional(node)) {
                errors.add("Unvalidated requirement: functional requirement \"" + node.id()
                    + "\" has no associated journey.");
            }
        }
        return errors;
    }
}
