package com.shoryokuka.domain.plan.model;

/**
 * Value kind of a {@link FactField}. Decides how the value is stored and formatted.
 */
public enum FactKind {
    TEXT,
    INTEGER,
    DECIMAL,
    STEPS
}
