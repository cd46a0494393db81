package com.shoryokuka.domain.plan.exception;

public class BackendUnavailableException extends PlanGenerationException {

    public BackendUnavailableException(String message, Throwable cause) {
        super("BACKEND_UNAVAILABLE", message, cause);
    }
}
