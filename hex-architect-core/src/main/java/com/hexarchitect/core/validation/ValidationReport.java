package com.hexarchitect.core.validation;

import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Findings produced by a validation run.
 *
 * @param findings findings in rule order
 */
public record ValidationReport(
    List<Finding> findings
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public List<Finding> violations() {
        return withSeverity(FindingSeverity.VIOLATION);
    }

    public List<Finding> warnings() {
        return withSeverity(FindingSeverity.WARNING);
    }

    public List<Finding> infos() {
        return withSeverity(FindingSeverity.INFO);
    }

    public boolean hasViolations() {
        return findings.stream().anyMatch(f -> f.severity() == FindingSeverity.VIOLATION);
    }

    /**
     * Returns the findings of one rule.
     *
     * @param ruleId rule identifier
     * @return findings produced by that rule
     */
    public List<Finding> byRule(String ruleId) {
        return findings.stream().filter(f -> f.ruleId().equals(ruleId)).toList();
    }

    /**
     * Counts findings per severity; every severity is present, possibly with zero.
     *
     * @return counts keyed by severity
     */
    public Map<FindingSeverity, Long> countBySeverity() {
        Map<FindingSeverity, Long> counts = new EnumMap<>(FindingSeverity.class);
        for (FindingSeverity severity : FindingSeverity.values()) {
            counts.put(severity, 0L);
        }
        findings.forEach(f -> counts.merge(f.severity(), 1L, Long::sum));
        return counts;
    }

    private List<Finding> withSeverity(FindingSeverity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }
}
