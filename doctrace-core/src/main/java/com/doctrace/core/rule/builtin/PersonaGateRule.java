package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.NodeMetadata;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Personas are mindmaps with {@code Role}, {@code Description} and {@code Goals} branches and a
 * {@code Type: <value>} node naming one of the persona types.
 *
 * <p>A valid type is recorded as {@link NodeMetadata#PERSONA_TYPE} on the persona's node, where
 * {@link PersonaDiversityRule} and {@link JourneyIntegrityRule} read it.
 */
public class PersonaGateRule extends AbstractRule {

    static final List<String> PERSONA_TYPES = List.of("actor", "influencer", "guardian", "proxy");

    private static final List<String> REQUIRED_BRANCHES = List.of("Role", "Description", "Goals");
    private static final String GOAL_PREFIX = "GOAL_";
    private static final String MINDMAP = "mindmap";
    private static final Pattern TYPE_NODE = Pattern.compile("(?i)\\btype\\s*(?::\\s*|\\(\\s*)([A-Za-z]*)");

    public PersonaGateRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null || !asset.isDiagram()) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        if (!RuleSupport.opensWithAny(asset, List.of(MINDMAP))) {
            errors.add("Personas must use \"mindmap\" notation.");
        }

        List<String> nodes = context.analysisOf(asset).nodes();
        for (String branch : REQUIRED_BRANCHES) {
            boolean present = nodes.stream().anyMatch(node -> node.equalsIgnoreCase(branch));
            if (!present && branch.equals("Goals")) {
                present = nodes.stream().anyMatch(node -> node.startsWith(GOAL_PREFIX));
            }
            if (!present) {
                errors.add("Persona mindmap: missing required branch \"" + branch + "\"");
            }
        }

        Optional<String> type = personaType(asset);
        if (type.isEmpty()) {
            errors.add("Persona mindmap: missing \"Type: <value>\" node (e.g. Type: Actor).");
        } else if (!PERSONA_TYPES.contains(type.get())) {
            errors.add("Persona mindmap: invalid persona type \"" + type.get()
                + "\". Must be one of: [Actor, Influencer, Guardian, Proxy]");
        } else if (asset.frontMatter().hasId()) {
            context.node(asset.id()).ifPresent(node -> {
                node.metadata().put(NodeMetadata.PERSONA_TYPE, type.get());
                log.debug("Recorded persona type {} for {}", type.get(), asset.id());
            });
        }
        return errors;
    }

    private static Optional<String> personaType(Asset asset) {
        for (String line : asset.body().split("\\R")) {
            Matcher matcher = TYPE_NODE.matcher(line);
            if (matcher.find()) {
                return Optional.of(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }
}
