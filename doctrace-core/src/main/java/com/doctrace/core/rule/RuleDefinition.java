package com.doctrace.core.rule;

import com.doctrace.core.model.Enforcement;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a rule configuration document.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * rules:
 *   - id: persona-gate
 *     name: Persona Architecture Gate
 *     level: folder
 *     target: { idPrefix: PER_, pathPattern: "personas/*" }
 *     type: structural
 *     enforcement: error
 *     hub: { id: GRP_Personas, title: Personas }
 * }</pre>
 *
 * <p>{@code implementation} names a catalog entry; when absent the rule id is used, and a rule
 * with only {@code checks} uses the {@code declarative} implementation.
 *
 * @param id unique rule id
 * @param name display name
 * @param description what the rule enforces
 * @param level evaluation scope
 * @param target asset selection
 * @param type reporting category
 * @param enforcement error or warning
 * @param implementation catalog implementation id
 * @param checks declarative checks
 * @param hub navigation category declared by a folder rule
 * @param enabled false removes a previously loaded rule with the same id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("level") RuleLevel level,
    @JsonProperty("target") RuleTarget target,
    @JsonProperty("type") RuleType type,
    @JsonProperty("enforcement") Enforcement enforcement,
    @JsonProperty("implementation") String implementation,
    @JsonProperty("checks") RuleChecks checks,
    @JsonProperty("hub") HubDefinition hub,
    @JsonProperty("enabled") Boolean enabled
) {
    public RuleDefinition {
        name = name == null || name.isBlank() ? id : name;
        level = level == null ? RuleLevel.FILE : level;
        target = target == null ? RuleTarget.any() : target;
        type = type == null ? RuleType.STRUCTURAL : type;
        enforcement = enforcement == null ? Enforcement.ERROR : enforcement;
        checks = checks == null ? RuleChecks.none() : checks;
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    /**
     * Creates a minimal definition for code-defined rules and tests.
     *
     * @param id rule id
     * @param level evaluation scope
     * @param target asset selection
     * @param enforcement error or warning
     * @return definition using the implementation of the same id
     */
    public static RuleDefinition of(String id, RuleLevel level, RuleTarget target, Enforcement enforcement) {
        return new RuleDefinition(id, id, null, level, target, RuleType.STRUCTURAL, enforcement, null, null, null, true);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Resolves the catalog implementation id of this definition.
     *
     * @param hasDeclarativeChecks true if the checks block is non-empty
     * @return implementation id
     */
    String implementationId(boolean hasDeclarativeChecks) {
        if (implementation != null && !implementation.isBlank()) {
            return implementation.trim();
        }
        return hasDeclarativeChecks ? RuleCatalog.DECLARATIVE : id;
    }

    RuleDefinition withImplementation(String implementationId) {
        return new RuleDefinition(id, name, description, level, target, type, enforcement, implementationId, checks,
            hub, enabled);
    }
}
