package com.doctrace.core.model;

import java.util.Objects;

/**
 * A single problem reported by a rule.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Violation violation = Violation.of(
 *     "filename-id",
 *     "Filename/ID Governance",
 *     "requirements/REQ_Login.mermaid",
 *     "File name \"REQ_Login\" does not match declared id \"REQ_Other\"",
 *     Enforcement.ERROR
 * );
 * }</pre>
 *
 * @param ruleId id of the rule that reported the problem
 * @param ruleName human-readable rule name
 * @param filePath relative path of the offending file, or {@code null} for project-level findings
 * @param message description of the problem
 * @param severity enforcement of the originating rule
 */
public record Violation(
    String ruleId,
    String ruleName,
    String filePath,
    String message,
    Enforcement severity
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (ruleName == null) {
            ruleName = ruleId;
        }
    }

    public static Violation of(String ruleId, String ruleName, String filePath, String message, Enforcement severity) {
        return new Violation(ruleId, ruleName, filePath, message, severity);
    }

    /**
     * Returns true if this violation fails the pass.
     *
     * @return true for {@link Enforcement#ERROR}
     */
    public boolean isError() {
        return severity == Enforcement.ERROR;
    }
}
