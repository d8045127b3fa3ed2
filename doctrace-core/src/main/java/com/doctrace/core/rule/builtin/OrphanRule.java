package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Every identifier a file declares must be referenced from elsewhere in the graph or be exempt.
 * Footnotes and the root rules guide annotate other documents and are not checked.
 */
public class OrphanRule extends AbstractRule {

    public OrphanRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null || DocsLayout.isInFootnotes(asset.relativePath())
            || DocsLayout.RULES_GUIDE.equals(asset.relativePath())) {
            return List.of();
        }
        List<String> errors = new ArrayList<>();
        for (String id : asset.frontMatter().declaredIds()) {
            if (!context.referencedIds().contains(id) && !context.isExempt(id)) {
                errors.add("Orphan detected: \"" + id + "\" is not referenced by any document or diagram. "
                    + "Mention it in a diagram, link it from another document or place the file in a category folder.");
            }
        }
        return errors;
    }
}
