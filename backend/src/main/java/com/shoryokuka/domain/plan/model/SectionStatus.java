package com.shoryokuka.domain.plan.model;

/**
 * Terminal outcome of a section within a run.
 */
public enum SectionStatus {
    ACCEPTED,
    EXHAUSTED,
    FAILED,
    CANCELLED;

    public boolean hasText() {
        return this != FAILED;
    }
}
