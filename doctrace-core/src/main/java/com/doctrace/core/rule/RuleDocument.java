package com.doctrace.core.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root of a rule configuration document: {@code rules: [...]}.
 *
 * @param rules rule definitions in file order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleDocument(@JsonProperty("rules") List<RuleDefinition> rules) {

    public RuleDocument {
        rules = rules == null ? List.of() : rules;
    }
}
