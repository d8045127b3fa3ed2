package com.doctrace.core.rule;

/**
 * Thrown when a rule configuration document cannot be read or describes an unusable rule.
 * Raised before any asset is processed.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
