package com.advotac.assistant.llm;

import java.time.Duration;

/**
 * One system+user prompt pair sent to the generative model.
 *
 * @param purpose short label used in logs ("expand", "rerank", ...)
 * @param temperature sampling temperature
 * @param maxTokens completion token cap; {@code 0} leaves the provider default
 * @param timeout wall-clock bound for the call
 */
public record CompletionRequest(
        String purpose,
        String systemPrompt,
        String userPrompt,
        double temperature,
        int maxTokens,
        Duration timeout) {
}
