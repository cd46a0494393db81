package com.shoryokuka.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.errors.InternalServerException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.RateLimitException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.shoryokuka.domain.plan.exception.BackendTransientException;
import com.shoryokuka.domain.plan.exception.BackendUnavailableException;
import com.shoryokuka.domain.plan.service.GenerationRequest;
import com.shoryokuka.domain.plan.service.TextGenerationBackend;
import com.shoryokuka.infrastructure.ai.preprocessing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Text backend on the OpenAI chat completions API.
 * Rate limits, server errors and I/O failures are reported as transient so the caller can retry.
 */
@Slf4j
public class OpenAiTextBackend implements TextGenerationBackend {

    private final OpenAIClient openAIClient;
    private final BackendUsageTracker usageTracker;
    private final TextNormalizer textNormalizer;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    public OpenAiTextBackend(OpenAIClient openAIClient, BackendUsageTracker usageTracker,
                             TextNormalizer textNormalizer, String model, double temperature, int maxTokens) {
        this.openAIClient = openAIClient;
        this.usageTracker = usageTracker;
        this.textNormalizer = textNormalizer;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String generate(GenerationRequest request) {
        return textNormalizer.normalize(call(request).content());
    }

    LlmCallResult call(GenerationRequest request) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(request.instruction())
                    .addUserMessage(request.input())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;
            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        model, promptTokens, completionTokens, usage.totalTokens());
            }
            usageTracker.recordUsage(promptTokens, completionTokens);

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new BackendUnavailableException("生成バックエンドの応答に本文がありません", null));

            return new LlmCallResult(content.trim(), promptTokens, completionTokens);
        } catch (BackendUnavailableException e) {
            usageTracker.recordFailure();
            throw e;
        } catch (RateLimitException | InternalServerException | OpenAIIoException e) {
            usageTracker.recordFailure();
            log.warn("OpenAI API call failed transiently [{}]: {}", model, e.getMessage());
            throw new BackendTransientException("生成バックエンドが一時的に利用できません", e);
        } catch (Exception e) {
            usageTracker.recordFailure();
            log.error("OpenAI API call failed [{}]", model, e);
            throw new BackendUnavailableException("生成バックエンドの呼び出しに失敗しました", e);
        }
    }
}
