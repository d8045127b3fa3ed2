package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reports each identifier declared by more than one file, once, naming every declaring file.
 */
public class DuplicateIdRule extends AbstractRule {

    public DuplicateIdRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : context.duplicateDeclarations().entrySet()) {
            errors.add("Duplicate id \"" + entry.getKey() + "\" declared in: " + String.join(", ", entry.getValue()));
        }
        return errors;
    }
}
