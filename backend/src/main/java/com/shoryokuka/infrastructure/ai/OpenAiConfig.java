package com.shoryokuka.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.shoryokuka.domain.plan.service.TextGenerationBackend;
import com.shoryokuka.infrastructure.ai.preprocessing.TextNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Text backend wiring, active only with {@code openai.enabled=true}. Without it the repair
 * engine uses its rule-based strategies only.
 */
@Configuration
@ConditionalOnProperty(name = "openai.enabled", havingValue = "true")
public class OpenAiConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.3}")
    private double temperature;

    @Value("${openai.max-tokens:1024}")
    private int maxTokens;

    @Value("${openai.timeout-seconds:30}")
    private long timeoutSeconds;

    @Value("${openai.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${openai.retry.initial-backoff-ms:500}")
    private long initialBackoffMs;

    @Value("${openai.retry.multiplier:2.0}")
    private double multiplier;

    @Bean
    public OpenAIClient openAIClient() {
        // Retries are handled by ResilientTextBackend
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(0)
                .build();
    }

    @Bean
    public OpenAiTextBackend openAiTextBackend(OpenAIClient openAIClient, BackendUsageTracker usageTracker,
                                               TextNormalizer textNormalizer) {
        return new OpenAiTextBackend(openAIClient, usageTracker, textNormalizer, model, temperature, maxTokens);
    }

    @Bean
    @Primary
    public TextGenerationBackend textGenerationBackend(OpenAiTextBackend openAiTextBackend) {
        return new ResilientTextBackend(openAiTextBackend,
                ResilientTextBackend.retryConfig(maxAttempts, Duration.ofMillis(initialBackoffMs), multiplier));
    }
}
