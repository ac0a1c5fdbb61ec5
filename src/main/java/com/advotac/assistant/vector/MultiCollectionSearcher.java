package com.advotac.assistant.vector;

import com.advotac.assistant.exception.RetrievalFailureException;
import com.advotac.assistant.model.Hit;
import com.advotac.assistant.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Fans one query vector out to every configured collection in parallel and pools the hits,
 * highest score first. A collection that errors or times out is logged and left out; the
 * others still count. Only when no collection answered at all does the search fail.
 */
@Component
public class MultiCollectionSearcher {
    private static final Logger log = LoggerFactory.getLogger(MultiCollectionSearcher.class);
    private final VectorSearchClient searchClient;
    private final ExecutorService executor;
    @Value("${advotac.retrieval.search-timeout-ms:5000}")
    private long searchTimeoutMs;

    public MultiCollectionSearcher(VectorSearchClient searchClient, @Qualifier("searchExecutor") ExecutorService executor) {
        this.searchClient = searchClient;
        this.executor = executor;
    }

    public List<Hit> search(float[] vector, int limit, List<String> collections) {
        if (collections == null || collections.isEmpty()) {
            throw new IllegalArgumentException("At least one collection is required");
        }
        List<String> targets = new ArrayList<>(new LinkedHashSet<>(collections));
        Map<String, Future<List<Hit>>> futures = new LinkedHashMap<>();
        int failed = 0;
        for (String collection : targets) {
            try {
                futures.put(collection, this.executor.submit(() -> this.searchClient.search(collection, vector, limit)));
            } catch (RejectedExecutionException e) {
                log.warn("Search pool overloaded; skipping collection {}", collection);
                ++failed;
            }
        }
        // every future is awaited against one shared deadline so a slow store cannot stack timeouts
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(this.searchTimeoutMs);
        List<Hit> pooled = new ArrayList<>();
        for (Map.Entry<String, Future<List<Hit>>> entry : futures.entrySet()) {
            String collection = entry.getKey();
            Future<List<Hit>> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                List<Hit> hits = future.get(remaining, TimeUnit.NANOSECONDS);
                if (hits != null) {
                    pooled.addAll(hits);
                }
                log.debug("Collection {} returned {} hits", collection, hits == null ? 0 : hits.size());
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Search in collection {} timed out after {}ms", collection, this.searchTimeoutMs);
                ++failed;
            } catch (InterruptedException e) {
                futures.values().forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new RetrievalFailureException("Vector search interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Search in collection {} failed: {}", collection, LogSanitizer.sanitize(cause.getMessage()));
                ++failed;
            }
        }
        if (failed == targets.size()) {
            throw new RetrievalFailureException("Vector search failed in all " + failed + " collection(s)");
        }
        pooled.sort(Comparator.comparingDouble(Hit::score).reversed());
        log.info("Pooled {} hits from {}/{} collections (limit {} each)", pooled.size(), targets.size() - failed, targets.size(), limit);
        return pooled;
    }
}
