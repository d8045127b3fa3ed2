package com.doctrace.core.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one validation pass.
 *
 * <p>Holds every violation found during the pass in evaluation order. The pass fails
 * when at least one {@link Enforcement#ERROR} violation exists; warnings never change the verdict.
 *
 * @param violations all violations in evaluation order
 * @param assetCount number of assets validated
 * @param rulesEvaluated number of rules in the active rule set
 */
public record ValidationReport(
    List<Violation> violations,
    int assetCount,
    int rulesEvaluated
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(violations, "violations must not be null");
        violations = List.copyOf(violations);
    }

    /**
     * Returns true if no error-level violation was reported.
     *
     * @return pass/fail verdict
     */
    public boolean passed() {
        return violations.stream().noneMatch(Violation::isError);
    }

    public List<Violation> errors() {
        return violations.stream().filter(Violation::isError).toList();
    }

    public List<Violation> warnings() {
        return violations.stream().filter(v -> !v.isError()).toList();
    }

    /**
     * Groups violations by severity, errors first.
     *
     * @return map of severity to violations (every severity present, possibly empty)
     */
    public Map<Enforcement, List<Violation>> bySeverity() {
        Map<Enforcement, List<Violation>> grouped = new EnumMap<>(Enforcement.class);
        for (Enforcement severity : Enforcement.values()) {
            grouped.put(severity, new ArrayList<>());
        }
        violations.forEach(v -> grouped.get(v.severity()).add(v));
        return grouped;
    }

    /**
     * Returns violations reported by one rule.
     *
     * @param ruleId rule id
     * @return matching violations
     */
    public List<Violation> forRule(String ruleId) {
        return violations.stream().filter(v -> v.ruleId().equals(ruleId)).toList();
    }
}
