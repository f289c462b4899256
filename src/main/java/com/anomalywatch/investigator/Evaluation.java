package com.anomalywatch.investigator;

import java.util.List;

/**
 * Outcome of evaluating all rules against one record.
 */
public record Evaluation<E, R extends Enum<R>>(E entity, List<RuleViolation<R>> violations) {

    public Evaluation {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean isAnomaly() {
        return !violations.isEmpty();
    }

    public boolean violates(R rule) {
        return violations.stream().anyMatch(v -> v.rule() == rule);
    }

    public List<String> reasons() {
        return violations.stream().map(RuleViolation::reason).toList();
    }
}
