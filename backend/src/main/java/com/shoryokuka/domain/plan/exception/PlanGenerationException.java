package com.shoryokuka.domain.plan.exception;

import lombok.Getter;

/**
 * Base of every failure raised by the generation pipeline.
 */
@Getter
public class PlanGenerationException extends RuntimeException {

    private final String errorCode;

    public PlanGenerationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PlanGenerationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
