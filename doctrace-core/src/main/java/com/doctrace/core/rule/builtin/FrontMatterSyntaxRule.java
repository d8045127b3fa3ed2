package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.List;

/**
 * Reports front-matter blocks that are not valid YAML.
 */
public class FrontMatterSyntaxRule extends AbstractRule {

    public FrontMatterSyntaxRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null || asset.frontMatterError() == null) {
            return List.of();
        }
        return List.of("Invalid front matter: " + asset.frontMatterError());
    }
}
