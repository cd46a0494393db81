package com.shoryokuka.domain.plan.model;

/**
 * Defect categories, in the order the detector checks them.
 */
public enum IssueCategory {
    STRUCTURAL_DRIFT,
    LENGTH_VIOLATION,
    GENERIC_PHRASE,
    REPETITION,
    UNNATURAL_PATTERN
}
