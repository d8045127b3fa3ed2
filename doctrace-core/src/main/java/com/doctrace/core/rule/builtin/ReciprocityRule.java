package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A downlink from A to B must be answered by an uplink from B to A. Requirements listed by B
 * count as uplinks. Downlinks to undeclared ids are left to the dangling-reference rule.
 */
public class ReciprocityRule extends AbstractRule {

    public ReciprocityRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        for (String id : asset.frontMatter().declaredIds()) {
            Optional<GraphNode> node = context.node(id);
            if (node.isEmpty() || !asset.relativePath().equals(context.idToFileMap().get(id))) {
                continue;
            }
            for (String target : node.get().downlinks()) {
                Optional<GraphNode> child = context.node(target);
                if (child.isPresent() && context.isDeclared(target) && !child.get().uplinks().contains(id)) {
                    errors.add("Broken reciprocity: \"" + id + "\" lists \"" + target
                        + "\" as a downlink but \"" + target + "\" has no uplink to \"" + id + "\"");
                }
            }
        }
        return errors;
    }
}
