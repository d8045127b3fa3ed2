package com.doctrace.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a rule violation affects the outcome of a validation pass.
 */
public enum Enforcement {
    /**
     * Violations fail the pass once every rule has run.
     */
    ERROR,

    /**
     * Violations are reported but never fail the pass.
     */
    WARNING;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Enforcement fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
