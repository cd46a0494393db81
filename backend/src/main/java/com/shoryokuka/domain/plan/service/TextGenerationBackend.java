package com.shoryokuka.domain.plan.service;

/**
 * Generative-text backend used by the repair engine for slot rewrites.
 */
public interface TextGenerationBackend {

    /**
     * @return generated text
     * @throws com.shoryokuka.domain.plan.exception.BackendTransientException   on a retryable failure
     * @throws com.shoryokuka.domain.plan.exception.BackendUnavailableException when the backend cannot serve
     */
    String generate(GenerationRequest request);
}
