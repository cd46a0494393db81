package com.shoryokuka.infrastructure.ai;

import com.shoryokuka.domain.plan.exception.BackendTransientException;
import com.shoryokuka.domain.plan.exception.BackendUnavailableException;
import com.shoryokuka.domain.plan.service.GenerationRequest;
import com.shoryokuka.domain.plan.service.TextGenerationBackend;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Decorates a {@link TextGenerationBackend} with a resilience4j retry for transient failures.
 * These retries are independent of the quality loop's repair budget. Once the retries are
 * spent the call fails with {@link BackendUnavailableException}.
 */
@Slf4j
public class ResilientTextBackend implements TextGenerationBackend {

    private final TextGenerationBackend delegate;
    private final Retry retry;

    public ResilientTextBackend(TextGenerationBackend delegate, RetryConfig config) {
        this.delegate = delegate;
        this.retry = Retry.of("textBackend", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying text backend call (attempt {}) after {}ms: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    public static RetryConfig retryConfig(int maxAttempts, Duration initialBackoff, double multiplier) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(BackendTransientException.class)
                .build();
    }

    @Override
    public String generate(GenerationRequest request) {
        Supplier<String> decorated = Retry.decorateSupplier(retry, () -> delegate.generate(request));
        try {
            return decorated.get();
        } catch (BackendTransientException e) {
            log.error("Text backend still failing after {} attempts", retry.getRetryConfig().getMaxAttempts());
            throw new BackendUnavailableException("生成バックエンドに接続できません（再試行上限に達しました）", e);
        }
    }
}
