package com.shoryokuka.domain.plan.model;

public enum DraftState {
    DRAFT,
    VALIDATED,
    REPAIRING,
    ACCEPTED,
    EXHAUSTED
}
