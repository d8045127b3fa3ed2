package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleChecks;
import com.doctrace.core.rule.RuleDefinition;
import com.doctrace.core.rule.TraceabilityChecks;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the {@code checks} block of a rule definition against one asset.
 *
 * <p>Checks run in a fixed order: notation, required nodes, required front matter, file
 * extension, single entity, node prefixes, then the traceability conditions. Notation and
 * node checks only apply to diagrams.
 */
public class DeclarativeRule extends AbstractRule {

    private static final Pattern PREFIXED_ID = Pattern.compile("^([A-Z][A-Z0-9]*_)\\w+");

    public DeclarativeRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null) {
            return List.of();
        }
        RuleChecks checks = definition.checks();
        List<String> errors = new ArrayList<>();

        if (asset.isDiagram() && !checks.mermaidType().isEmpty() && !RuleSupport.opensWithAny(asset, checks.mermaidType())) {
            errors.add("Must use diagram notation " + RuleSupport.quotedList(checks.mermaidType())
                + ". Found: \"" + RuleSupport.openingLine(asset) + "\"");
        }
        if (asset.isDiagram()) {
            checkRequiredNodes(asset, context, checks.requiredNodes(), errors);
        }
        errors.addAll(RuleSupport.missingFields(asset.frontMatter(), checks.requiredFrontmatter()));
        checkExtension(asset, checks.requiredExtension(), errors);

        if (checks.onePerFile() && asset.frontMatter().declaredIds().size() != 1) {
            errors.add("Exactly one entity must be declared per file. Found: " + asset.frontMatter().declaredIds().size());
        }
        if (asset.isDiagram() && !checks.allowedNodePrefixes().isEmpty()) {
            for (String node : context.analysisOf(asset).nodes()) {
                Matcher matcher = PREFIXED_ID.matcher(node);
                if (matcher.find() && !RuleSupport.startsWithAny(node, checks.allowedNodePrefixes())) {
                    errors.add("Node \"" + node + "\" uses prefix \"" + matcher.group(1) + "\"; allowed: "
                        + RuleSupport.quotedList(checks.allowedNodePrefixes()));
                }
            }
        }
        if (checks.traceability() != null) {
            checkTraceability(asset, context, checks.traceability(), errors);
        }
        return errors;
    }

    private static void checkRequiredNodes(Asset asset, ProjectContext context, List<String> required, List<String> errors) {
        if (required.isEmpty()) {
            return;
        }
        List<String> nodes = context.analysisOf(asset).nodes();
        List<String> lines = asset.body().lines().map(String::trim).toList();
        for (String name : required) {
            boolean inAnalysis = nodes.stream().anyMatch(node -> node.equalsIgnoreCase(name));
            String lower = name.toLowerCase(Locale.ROOT);
            boolean inText = lines.stream().anyMatch(line -> line.toLowerCase(Locale.ROOT).startsWith(lower));
            if (!inAnalysis && !inText) {
                errors.add("Missing required node: \"" + name + "\"");
            }
        }
    }

    private static void checkExtension(Asset asset, String requiredExtension, List<String> errors) {
        if (requiredExtension == null || requiredExtension.isBlank()) {
            return;
        }
        String expected = requiredExtension.startsWith(".") ? requiredExtension.substring(1) : requiredExtension;
        if (!asset.extension().equalsIgnoreCase(expected)) {
            errors.add("File must have extension \"." + expected + "\"");
        }
    }

    private static void checkTraceability(Asset asset, ProjectContext context, TraceabilityChecks checks,
                                          List<String> errors) {
        if (checks.mustBeLinked()) {
            for (String id : asset.frontMatter().declaredIds()) {
                if (!context.referencedIds().contains(id) && !context.isExempt(id)) {
                    errors.add("Entity \"" + id + "\" must be linked from another document or diagram.");
                }
            }
        }
        Optional<GraphNode> node = asset.frontMatter().hasId() ? context.node(asset.id()) : Optional.empty();
        if (node.isEmpty()) {
            return;
        }
        GraphNode self = node.get();
        if (!checks.mustTraceTo().isEmpty()
            && self.uplinks().stream().noneMatch(up -> RuleSupport.startsWithAny(up, checks.mustTraceTo()))) {
            errors.add("\"" + self.id() + "\" must trace to " + RuleSupport.quotedList(checks.mustTraceTo()) + " (uplink).");
        }
        if (!checks.mustHaveDownlink().isEmpty()
            && self.downlinks().stream().noneMatch(down -> RuleSupport.startsWithAny(down, checks.mustHaveDownlink()))) {
            errors.add("\"" + self.id() + "\" must have a downlink to " + RuleSupport.quotedList(checks.mustHaveDownlink()) + ".");
        }
        if (!checks.allowedDownlinkPrefixes().isEmpty()) {
            for (String down : self.downlinks()) {
                if (!RuleSupport.startsWithAny(down, checks.allowedDownlinkPrefixes())) {
                    errors.add("Downlink \"" + down + "\" of \"" + self.id() + "\" is not allowed; expected "
                        + RuleSupport.quotedList(checks.allowedDownlinkPrefixes()) + ".");
                }
            }
        }
    }
}
