package com.shoryokuka.domain.plan.exception;

/**
 * A template references a fact or slot that does not exist. Configuration bug.
 */
public class TemplateMismatchException extends PlanGenerationException {

    public TemplateMismatchException(String message) {
        super("TEMPLATE_MISMATCH", message);
    }
}
