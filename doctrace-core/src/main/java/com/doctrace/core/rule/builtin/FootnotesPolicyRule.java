package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Footnotes must be markdown files with {@code title}, {@code description} and {@code id}.
 */
public class FootnotesPolicyRule extends AbstractRule {

    public FootnotesPolicyRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        if (!asset.isMarkdown()) {
            errors.add("Footnotes must be Markdown (.md) files.");
        }
        errors.addAll(RuleSupport.missingFields(asset.frontMatter(), RequiredFieldsRule.DEFAULT_FIELDS));
        return errors;
    }
}
