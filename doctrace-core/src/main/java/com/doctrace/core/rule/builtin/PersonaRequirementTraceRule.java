package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Personas drive main requirements and main requirements are driven by personas.
 *
 * <p>A main requirement is a {@code REQ_} node without a {@code REQ_} uplink. A persona drives a
 * requirement when it lists it as a downlink or the requirement lists the persona as an uplink.
 */
public class PersonaRequirementTraceRule extends AbstractRule {

    public PersonaRequirementTraceRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        List<String> errors = new ArrayList<>();
        for (GraphNode node : context.nodeMap().values()) {
            if (!context.isDeclared(node.id()) || RuleSupport.isFootnoteId(context, node.id())) {
                continue;
            }
            if (node.id().startsWith(RuleSupport.PERSONA)) {
                checkPersona(node, context, errors);
            } else if (node.id().startsWith(RuleSupport.REQUIREMENT)
                && !node.hasUplinkWithPrefix(RuleSupport.REQUIREMENT)
                && !drivenByPersona(node, context)) {
                errors.add("Abandoned requirement: main requirement \"" + node.id() + "\" has no linked persona.");
            }
        }
        return errors;
    }

    private static boolean drivenByPersona(GraphNode requirement, ProjectContext context) {
        if (requirement.hasUplinkWithPrefix(RuleSupport.PERSONA)) {
            return true;
        }
        return context.nodeMap().values().stream()
            .anyMatch(node -> node.id().startsWith(RuleSupport.PERSONA) && node.downlinks().contains(requirement.id()));
    }

    private static void checkPersona(GraphNode persona, ProjectContext context, List<String> errors) {
        Set<String> requirements = RuleSupport.linkedChildren(context, persona, RuleSupport.REQUIREMENT);
        if (requirements.isEmpty()) {
            errors.add("Ghost persona: \"" + persona.id() + "\" drives no requirement.");
            return;
        }
        for (String requirement : requirements) {
            Optional<GraphNode> node = context.node(requirement);
            if (node.isPresent() && node.get().hasUplinkWithPrefix(RuleSupport.REQUIREMENT)) {
                errors.add("Persona \"" + persona.id() + "\" is linked to sub-requirement \"" + requirement
                    + "\"; link its main requirement instead.");
            }
        }
    }
}
