package com.doctrace.core.rule;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.model.Enforcement;

import java.util.List;
import java.util.Optional;

/**
 * A validation rule over one asset or over the whole project.
 *
 * <p>Rules are pure apart from one sanctioned side channel: they may add facts to
 * {@link com.doctrace.core.graph.NodeMetadata}. A rule that writes a key documents the rules
 * that read it.
 *
 * @see AbstractRule
 * @see RuleCatalog
 */
public interface Rule {

    String id();

    String name();

    String description();

    RuleLevel level();

    RuleTarget target();

    RuleType type();

    Enforcement enforcement();

    Optional<HubDefinition> hub();

    /**
     * Returns true if this asset-level rule applies to the asset. Project-level rules are
     * evaluated once regardless of targeting.
     *
     * @param asset asset
     * @return true if the rule's target selects the asset
     */
    default boolean appliesTo(Asset asset) {
        return target().matches(asset);
    }

    /**
     * Validates an asset, or the whole project for {@link RuleLevel#PROJECT} rules.
     *
     * @param asset asset under validation; {@code null} for project-level rules
     * @param context complete project context
     * @return violation messages, empty when the rule is satisfied
     */
    List<String> validate(Asset asset, ProjectContext context);
}
