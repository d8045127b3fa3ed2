package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.List;

/**
 * Requires a file's base name to equal its declared id. The root {@code RULES_GUIDE.md} and
 * files without an id are skipped.
 */
public class FilenameIdRule extends AbstractRule {

    public FilenameIdRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null || !asset.frontMatter().hasId() || DocsLayout.RULES_GUIDE.equals(asset.relativePath())) {
            return List.of();
        }
        if (!asset.isDiagram() && !asset.isMarkdown()) {
            return List.of();
        }
        if (asset.id().equals(asset.baseName())) {
            return List.of();
        }
        return List.of("Filename-ID mismatch: file name \"" + asset.baseName()
            + "\" does not match declared id \"" + asset.id() + "\"");
    }
}
