package com.shoryokuka.domain.plan.exception;

/**
 * Retryable text-backend failure (rate limit, 5xx, I/O, timeout).
 */
public class BackendTransientException extends PlanGenerationException {

    public BackendTransientException(String message, Throwable cause) {
        super("BACKEND_TRANSIENT", message, cause);
    }
}
