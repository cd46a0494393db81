package com.shoryokuka.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class BackendUsageTracker {

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void recordUsage(long promptTokens, long completionTokens) {
        totalCalls.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        log.info("Backend usage - call #{}: promptTokens={}, completionTokens={}, " +
                        "cumulative: promptTokens={}, completionTokens={}, failureRate={}%",
                totalCalls.get(), promptTokens, completionTokens,
                totalPromptTokens.get(), totalCompletionTokens.get(), String.format("%.1f", getFailureRate()));
    }

    public void recordFailure() {
        totalCalls.incrementAndGet();
        failedCalls.incrementAndGet();
    }

    public long getTotalCalls() {
        return totalCalls.get();
    }

    public double getFailureRate() {
        long total = totalCalls.get();
        return total > 0 ? (double) failedCalls.get() / total * 100 : 0;
    }
}
