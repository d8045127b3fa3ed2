package com.doctrace.core.rule;

import com.doctrace.core.model.Enforcement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class for rules configured from a {@link RuleDefinition}.
 */
public abstract class AbstractRule implements Rule {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final RuleDefinition definition;

    protected AbstractRule(RuleDefinition definition) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
    }

    @Override
    public String id() {
        return definition.id();
    }

    @Override
    public String name() {
        return definition.name();
    }

    @Override
    public String description() {
        return definition.description();
    }

    @Override
    public RuleLevel level() {
        return definition.level();
    }

    @Override
    public RuleTarget target() {
        return definition.target();
    }

    @Override
    public RuleType type() {
        return definition.type();
    }

    @Override
    public Enforcement enforcement() {
        return definition.enforcement();
    }

    @Override
    public Optional<HubDefinition> hub() {
        return Optional.ofNullable(definition.hub());
    }

    public RuleDefinition definition() {
        return definition;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + id() + "}";
    }
}
