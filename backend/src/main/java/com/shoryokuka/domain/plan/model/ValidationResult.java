package com.shoryokuka.domain.plan.model;

import java.util.List;

/**
 * Result of one detector pass.
 *
 * @param score  quality score in [0, 1]
 * @param issues issues in catalogue order
 */
public record ValidationResult(
        double score,
        List<ValidationIssue> issues
) {
    public ValidationResult {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        issues = List.copyOf(issues);
    }

    public static ValidationResult clean() {
        return new ValidationResult(1.0, List.of());
    }

    public boolean hasStructuralDrift() {
        return issues.stream().anyMatch(i -> i.category() == IssueCategory.STRUCTURAL_DRIFT);
    }

    public List<ValidationIssue> issuesOf(IssueCategory category) {
        return issues.stream().filter(i -> i.category() == category).toList();
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }
}
