package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.FrontMatter;
import com.doctrace.core.asset.FrontMatterEntity;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports front-matter links whose target is never declared. Diagram mentions are not
 * considered; only explicit {@code uplink}, {@code downlinks} and {@code requirements}.
 */
public class DanglingReferenceRule extends AbstractRule {

    public DanglingReferenceRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null) {
            return List.of();
        }
        FrontMatter frontMatter = asset.frontMatter();
        Set<String> reported = new LinkedHashSet<>();
        List<String> errors = new ArrayList<>();
        String source = frontMatter.hasId() ? frontMatter.id() : asset.relativePath();
        check(source, frontMatter.uplinks(), "uplink", context, reported, errors);
        check(source, frontMatter.requirements(), "requirement", context, reported, errors);
        check(source, frontMatter.downlinks(), "downlink", context, reported, errors);
        for (FrontMatterEntity entity : frontMatter.entities()) {
            check(entity.id(), entity.uplinks(), "uplink", context, reported, errors);
            check(entity.id(), entity.requirements(), "requirement", context, reported, errors);
            check(entity.id(), entity.downlinks(), "downlink", context, reported, errors);
        }
        return errors;
    }

    private static void check(String source, List<String> targets, String kind, ProjectContext context,
                              Set<String> reported, List<String> errors) {
        for (String target : targets) {
            if (context.isDeclared(target) || context.isExempt(target) || !reported.add(source + "->" + target)) {
                continue;
            }
            errors.add("Dangling reference: " + kind + " \"" + target + "\" of \"" + source
                + "\" is not declared by any document.");
        }
    }
}
