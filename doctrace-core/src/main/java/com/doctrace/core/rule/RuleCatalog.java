package com.doctrace.core.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps implementation ids to rule factories, so a rule configuration document can select
 * among a fixed set of implementations. Code may register further implementations.
 */
public final class RuleCatalog {

    /** Implementation evaluating a rule's {@code checks} block */
    public static final String DECLARATIVE = "declarative";

    private final Map<String, RuleFactory> factories = new LinkedHashMap<>();

    /**
     * Registers an implementation, replacing any previous one with the same id.
     *
     * @param implementationId id referenced from {@code implementation:}
     * @param factory rule factory
     * @return this catalog
     */
    public RuleCatalog register(String implementationId, RuleFactory factory) {
        factories.put(Objects.requireNonNull(implementationId), Objects.requireNonNull(factory));
        return this;
    }

    public boolean contains(String implementationId) {
        return factories.containsKey(implementationId);
    }

    public Set<String> implementationIds() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * Creates the rule a definition describes.
     *
     * @param definition rule definition
     * @return rule
     * @throws RuleConfigurationException if the definition names no known implementation
     */
    public Rule create(RuleDefinition definition) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new RuleConfigurationException("Rule definition without id");
        }
        boolean declarative = !RuleChecks.none().equals(definition.checks());
        String implementationId = definition.implementationId(declarative);
        RuleFactory factory = factories.get(implementationId);
        if (factory == null) {
            throw new RuleConfigurationException(
                "Rule '" + definition.id() + "' uses unknown implementation '" + implementationId
                    + "'. Known implementations: " + factories.keySet());
        }
        return factory.create(definition.withImplementation(implementationId));
    }
}
