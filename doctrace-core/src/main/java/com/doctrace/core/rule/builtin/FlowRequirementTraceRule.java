package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.NodeMetadata;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Every flow document traces to at least one requirement.
 */
public class FlowRequirementTraceRule extends AbstractRule {

    public FlowRequirementTraceRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        List<String> errors = new ArrayList<>();
        for (GraphNode node : context.nodeMap().values()) {
            if (node.id().startsWith(RuleSupport.FLOW)
                && node.metadata().isTrue(NodeMetadata.IS_FILE_ROOT)
                && !node.hasUplinkWithPrefix(RuleSupport.REQUIREMENT)) {
                errors.add("Untraced flow: \"" + node.id() + "\" must trace to a requirement (REQ_...).");
            }
        }
        return errors;
    }
}
