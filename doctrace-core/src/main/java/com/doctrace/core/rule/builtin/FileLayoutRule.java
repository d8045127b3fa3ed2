package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;
import com.doctrace.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Enforces which files may live where:
 * <ul>
 *   <li>outside {@code others/}, only diagrams, markdown and images are allowed</li>
 *   <li>markdown lives in {@code footnotes/} folders; the root {@code RULES_GUIDE.md} is the exception</li>
 * </ul>
 */
public class FileLayoutRule extends AbstractRule {

    public FileLayoutRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        List<String> errors = new ArrayList<>();
        for (String file : context.otherFiles()) {
            if (DocsLayout.isInOthers(file)) {
                continue;
            }
            if (!DocsLayout.IMAGE_EXTENSIONS.contains(FileUtils.getExtension(file))) {
                errors.add("Foreign file \"" + file + "\": only .mermaid, .md and image files are allowed outside others/.");
            }
        }
        for (Asset candidate : context.assets()) {
            String path = candidate.relativePath();
            if (candidate.isMarkdown() && !DocsLayout.isInFootnotes(path) && !DocsLayout.RULES_GUIDE.equals(path)) {
                errors.add("Markdown file \"" + path + "\" must live in a footnotes/ folder.");
            }
        }
        return errors;
    }
}
