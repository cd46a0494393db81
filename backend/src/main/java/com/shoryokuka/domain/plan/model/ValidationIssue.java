package com.shoryokuka.domain.plan.model;

/**
 * Individual defect found by the detector.
 *
 * @param category    defect category
 * @param severity    ERROR blocks acceptance of structural defects, WARNING only costs score
 * @param location    section, slot and offsets
 * @param message     human-readable description of the issue
 * @param matchedText the text that triggered the issue (nullable)
 * @param ruleId      detector rule that produced the issue, used by the repair engine
 */
public record ValidationIssue(
        IssueCategory category,
        Severity severity,
        IssueLocation location,
        String message,
        String matchedText,
        String ruleId
) {
    public enum Severity {
        ERROR,
        WARNING
    }

    public int slotIndex() {
        return location.slotIndex();
    }
}
