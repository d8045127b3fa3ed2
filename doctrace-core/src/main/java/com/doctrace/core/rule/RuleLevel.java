package com.doctrace.core.rule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Scope a rule is evaluated at.
 */
public enum RuleLevel {
    /** Evaluated once against the whole project context */
    PROJECT,
    /** Evaluated per asset of a claimed folder; may declare a hub category */
    FOLDER,
    /** Evaluated per matching asset */
    FILE,
    /** Evaluated per matching asset, concerned with individual nodes */
    NODE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FILE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isProjectLevel() {
        return this == PROJECT;
    }
}
