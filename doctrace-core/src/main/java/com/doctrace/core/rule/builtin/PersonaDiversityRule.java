package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.NodeMetadata;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The project defines at least one persona of every type. Reads the types recorded by
 * {@link PersonaGateRule}.
 */
public class PersonaDiversityRule extends AbstractRule {

    public PersonaDiversityRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        Set<String> found = new HashSet<>();
        for (GraphNode node : context.nodeMap().values()) {
            node.metadata().getString(NodeMetadata.PERSONA_TYPE)
                .ifPresent(type -> found.add(type.toLowerCase(Locale.ROOT)));
        }
        List<String> missing = PersonaGateRule.PERSONA_TYPES.stream()
            .filter(type -> !found.contains(type))
            .map(RuleSupport::capitalize)
            .toList();
        if (missing.isEmpty()) {
            return List.of();
        }
        return List.of("Missing mandatory persona types: [" + String.join(", ", missing) + "]");
    }
}
