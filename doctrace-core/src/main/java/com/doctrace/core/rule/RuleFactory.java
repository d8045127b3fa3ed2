package com.doctrace.core.rule;

/**
 * Creates a rule from its configuration.
 */
@FunctionalInterface
public interface RuleFactory {

    Rule create(RuleDefinition definition);
}
