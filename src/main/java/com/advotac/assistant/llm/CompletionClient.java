package com.advotac.assistant.llm;

import com.advotac.assistant.util.LogSanitizer;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * The single gateway to the generative model: {@code complete(system, user) -> text}.
 * Query expansion, reranking, generation and validation differ only in the prompt and in how
 * they read the reply. Each call runs on the model executor; once its timeout passes the worker
 * is interrupted so the slot can be reused.
 */
@Component
public class CompletionClient {
    private static final Logger log = LoggerFactory.getLogger(CompletionClient.class);
    private final ChatClient chatClient;
    private final ExecutorService executor;

    public CompletionClient(ChatClient.Builder builder, @Qualifier("modelExecutor") ExecutorService executor) {
        this.chatClient = builder.build();
        this.executor = executor;
    }

    public String complete(CompletionRequest request) {
        long start = System.currentTimeMillis();
        Future<String> future = this.executor.submit(() -> this.call(request));
        String content;
        try {
            content = future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelCallException(request.purpose() + " call timed out after " + request.timeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModelCallException(request.purpose() + " call interrupted", e);
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ModelCallException(request.purpose() + " call failed: " + LogSanitizer.sanitize(cause.getMessage()), cause);
        }
        if (content == null || content.isBlank()) {
            throw new ModelCallException(request.purpose() + " call returned no content");
        }
        if (log.isDebugEnabled()) {
            log.debug("Model call '{}' completed in {}ms ({} chars)", request.purpose(), System.currentTimeMillis() - start, content.length());
        }
        return content.trim();
    }

    private String call(CompletionRequest request) {
        ChatOptions.Builder options = ChatOptions.builder().temperature(request.temperature());
        if (request.maxTokens() > 0) {
            options.maxTokens(request.maxTokens());
        }
        return this.chatClient.prompt()
                .system(request.systemPrompt())
                .user(request.userPrompt())
                .options(options.build())
                .call()
                .content();
    }
}
