package com.codifier.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative token usage of the llm extraction pass, including prompt-cache hits.
 */
@Slf4j
@Component
public class LlmUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicLong totalCachedTokens = new AtomicLong();

    public void recordUsage(long promptTokens, long completionTokens, long cachedTokens) {
        long requests = totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);
        totalCachedTokens.addAndGet(cachedTokens);

        log.debug("[OpenAI] request #{}: promptTokens={}, completionTokens={}, cachedTokens={}, cumulative tokenCacheRate={}%",
                requests, promptTokens, completionTokens, cachedTokens, String.format("%.1f", getTokenCacheRate()));
    }

    public void recordFailure() {
        failedRequests.incrementAndGet();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getFailedRequests() {
        return failedRequests.get();
    }

    public long getTotalPromptTokens() {
        return totalPromptTokens.get();
    }

    public long getTotalCompletionTokens() {
        return totalCompletionTokens.get();
    }

    public double getTokenCacheRate() {
        long total = totalPromptTokens.get();
        return total > 0 ? (double) totalCachedTokens.get() / total * 100 : 0;
    }
}
