package com.doctrace.core.rule;

import com.doctrace.core.graph.FolderClaim;
import com.doctrace.core.graph.GraphSettings;
import com.doctrace.core.graph.HubCategory;
import com.doctrace.core.util.PathPatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, immutable collection of rules. Order is load order: built-in rules first, then user
 * additions.
 */
public final class RuleSet {

    private final List<Rule> rules;

    public RuleSet(List<? extends Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public List<Rule> assetRules() {
        return rules.stream().filter(rule -> !rule.level().isProjectLevel()).toList();
    }

    public List<Rule> projectRules() {
        return rules.stream().filter(rule -> rule.level().isProjectLevel()).toList();
    }

    public Optional<Rule> find(String id) {
        return rules.stream().filter(rule -> rule.id().equals(id)).findFirst();
    }

    /**
     * Returns a rule set with a code-defined rule added. A rule with the same id is replaced in place.
     *
     * @param rule rule to add
     * @return new rule set
     */
    public RuleSet with(Rule rule) {
        List<Rule> updated = new ArrayList<>(rules);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).id().equals(rule.id())) {
                updated.set(i, rule);
                return new RuleSet(updated);
            }
        }
        updated.add(rule);
        return new RuleSet(updated);
    }

    /**
     * Derives hub categories from rules that declare a hub and target a folder
     * ({@code personas/*} gives path {@code personas}).
     *
     * @return categories in rule order
     */
    public List<HubCategory> hubCategories() {
        List<HubCategory> categories = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.hub().isEmpty() || !rule.target().hasPathPattern()) {
                continue;
            }
            HubDefinition hub = rule.hub().get();
            String path = PathPatterns.literalFolder(rule.target().pathPattern());
            if (hub.id() != null && !path.isEmpty()) {
                categories.add(new HubCategory(hub.id(), hub.title(), path, rule.target().idPrefix()));
            }
        }
        return categories;
    }

    /**
     * Derives the folders claimed by folder-level rules.
     *
     * @return claims in rule order
     */
    public List<FolderClaim> folderClaims() {
        List<FolderClaim> claims = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.level() != RuleLevel.FOLDER || !rule.target().hasPathPattern()) {
                continue;
            }
            String path = PathPatterns.literalFolder(rule.target().pathPattern());
            if (!path.isEmpty()) {
                claims.add(new FolderClaim(rule.id(), path, rule.target().idPrefix()));
            }
        }
        return claims;
    }

    public GraphSettings graphSettings(Set<String> exemptIds) {
        return new GraphSettings(hubCategories(), folderClaims(), exemptIds);
    }
}
