package com.codifier.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper around the OpenAI chat completion call. Prompting and parsing live in the callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiChatService {

    private final OpenAIClient openAIClient;
    private final LlmUsageTracker usageTracker;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.1}")
    private double temperature;

    @Value("${openai.max-tokens:1500}")
    private int maxTokens;

    /**
     * Chat completion in JSON mode.
     *
     * @param systemPrompt system prompt
     * @param userMessage  user message
     * @return raw JSON content of the first choice
     * @throws LlmCallException when the call fails or returns no content
     */
    public String completeJson(String systemPrompt, String userMessage) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            completion.usage().ifPresent(usage -> {
                long cachedTokens = usage.promptTokensDetails()
                        .map(d -> d.cachedTokens().orElse(0L))
                        .orElse(0L);
                usageTracker.recordUsage(usage.promptTokens(), usage.completionTokens(), cachedTokens);
            });

            return completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .map(String::trim)
                    .orElseThrow(() -> new LlmCallException("OpenAI response has no content"));
        } catch (LlmCallException e) {
            usageTracker.recordFailure();
            throw e;
        } catch (Exception e) {
            usageTracker.recordFailure();
            log.error("[OpenAI] Chat completion failed [{}]", model, e);
            throw new LlmCallException("OpenAI chat completion failed: " + e.getMessage(), e);
        }
    }
}
