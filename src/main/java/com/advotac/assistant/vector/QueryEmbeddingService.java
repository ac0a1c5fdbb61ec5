package com.advotac.assistant.vector;

import com.advotac.assistant.exception.RetrievalFailureException;
import com.advotac.assistant.util.LogSanitizer;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns the query into the vector space the index was built in. There is no fallback:
 * any failure or an empty vector is a {@link RetrievalFailureException}.
 */
@Service
public class QueryEmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(QueryEmbeddingService.class);
    private final EmbeddingModel embeddingModel;
    private final ExecutorService executor;
    @Value("${advotac.embedding.timeout-ms:10000}")
    private long timeoutMs;

    public QueryEmbeddingService(EmbeddingModel embeddingModel, @Qualifier("modelExecutor") ExecutorService executor) {
        this.embeddingModel = embeddingModel;
        this.executor = executor;
    }

    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to embed must not be blank");
        }
        long start = System.currentTimeMillis();
        Future<float[]> future = this.executor.submit(() -> this.embeddingModel.embed(text));
        float[] vector;
        try {
            vector = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RetrievalFailureException("Embedding timed out after " + this.timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetrievalFailureException("Embedding interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RetrievalFailureException("Failed to create embedding for the query", cause);
        }
        if (vector == null || vector.length == 0) {
            throw new RetrievalFailureException("Embedding service returned no vector");
        }
        log.debug("Embedded query {} into {} dims in {}ms", LogSanitizer.querySummary(text), vector.length, System.currentTimeMillis() - start);
        return vector;
    }
}
