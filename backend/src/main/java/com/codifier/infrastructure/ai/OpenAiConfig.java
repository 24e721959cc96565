package com.codifier.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class OpenAiConfig {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.timeout-seconds:60}")
    private long timeoutSeconds;

    @Bean
    public OpenAIClient openAIClient() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[OpenAI] openai.api-key is not set; the llm extraction pass will fail and degrade to a single pass");
        }
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey == null ? "" : apiKey)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
