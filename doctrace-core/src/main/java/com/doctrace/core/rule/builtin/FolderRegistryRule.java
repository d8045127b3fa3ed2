package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.graph.FolderClaim;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every directory of the docs tree is governed by a folder-level rule, and no folder is claimed
 * by two rules.
 *
 * <p>{@code footnotes} segments are ignored and the {@code others} tree is free-form. A
 * directory is governed when it equals or lies below a claimed folder.
 */
public class FolderRegistryRule extends AbstractRule {

    public FolderRegistryRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        List<String> errors = new ArrayList<>();

        Map<String, List<String>> claimsByPath = new LinkedHashMap<>();
        for (FolderClaim claim : context.folderClaims()) {
            claimsByPath.computeIfAbsent(claim.path(), path -> new ArrayList<>()).add(claim.ruleId());
        }
        claimsByPath.forEach((path, ruleIds) -> {
            if (ruleIds.size() > 1) {
                errors.add("Folder \"" + path + "\" is claimed by more than one rule: " + String.join(", ", ruleIds));
            }
        });

        Set<String> checked = new LinkedHashSet<>();
        for (String directory : context.directories()) {
            if (DocsLayout.isInOthers(directory)) {
                continue;
            }
            String folder = withoutSystemSegments(directory);
            if (folder.isEmpty() || !checked.add(folder)) {
                continue;
            }
            boolean governed = claimsByPath.keySet().stream().anyMatch(path -> DocsLayout.isWithin(path, folder));
            if (!governed) {
                errors.add("Unregistered folder: \"" + directory + "\" is not governed by any folder-level rule.");
            }
        }
        return errors;
    }

    private static String withoutSystemSegments(String directory) {
        return Arrays.stream(directory.split("/"))
            .filter(segment -> !DocsLayout.FOOTNOTES_FOLDER.equals(segment))
            .collect(Collectors.joining("/"));
    }
}
