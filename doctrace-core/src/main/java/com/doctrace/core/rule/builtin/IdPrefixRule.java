package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.graph.FolderClaim;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.rule.AbstractRule;
import com.doctrace.core.rule.RuleDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Requires the id of a file to start with the prefix of the folder-level rule governing its
 * folder. Footnotes are governed by the folder that holds their {@code footnotes} directory.
 */
public class IdPrefixRule extends AbstractRule {

    public IdPrefixRule(RuleDefinition definition) {
        super(definition);
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        if (asset == null || !asset.frontMatter().hasId()) {
            return List.of();
        }
        String folder = DocsLayout.governingFolder(asset.relativePath());
        Optional<FolderClaim> claim = context.claimFor(folder).filter(FolderClaim::hasIdPrefix);
        if (claim.isEmpty() || asset.id().startsWith(claim.get().idPrefix())) {
            return List.of();
        }
        return List.of("ID prefix mismatch: ids in folder \"" + claim.get().path() + "\" must start with \""
            + claim.get().idPrefix() + "\". Found: \"" + asset.id() + "\"");
    }
}
