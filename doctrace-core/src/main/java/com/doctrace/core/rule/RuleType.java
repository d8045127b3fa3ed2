package com.doctrace.core.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Reporting category of a rule.
 */
public enum RuleType {
    STRUCTURAL,
    SYNTAX,
    METADATA,
    TRACEABILITY;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return STRUCTURAL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
