package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.List;

/**
 * Requires front-matter keys to be present and non-empty. Checks {@code checks.requiredFrontmatter},
 * or {@code title}, {@code description} and {@code id} when none are configured.
 */
public class RequiredFieldsRule extends AbstractRule {

    static final List<String> DEFAULT_FIELDS = List.of("title", "description", "id");

    public RequiredFieldsRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null) {
            return List.of();
        }
        List<String> fields = definition.checks().requiredFrontmatter();
        return RuleSupport.missingFields(asset.frontMatter(), fields.isEmpty() ? DEFAULT_FIELDS : fields);
    }
}
