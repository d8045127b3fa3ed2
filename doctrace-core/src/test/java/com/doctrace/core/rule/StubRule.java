package com.doctrace.core.rule;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.ProjectContext;

import java.util.List;
import java.util.function.BiFunction;

/**
 * Rule with a pluggable body for engine and loader tests.
 */
class StubRule extends AbstractRule {

    private final BiFunction<Asset, ProjectContext, List<String>> body;

    StubRule(RuleDefinition definition) {
        this(definition, (asset, context) -> List.of());
    }

    StubRule(RuleDefinition definition, BiFunction<Asset, ProjectContext, List<String>> body) {
        super(definition);
        this.body = body;
    }

    @Override
    public List<String> validate(Asset asset, ProjectContext context) {
        return body.apply(asset, context);
    }
}
