package com.advotac.assistant.rag.expansion;

import com.advotac.assistant.llm.CompletionClient;
import com.advotac.assistant.llm.CompletionRequest;
import com.advotac.assistant.util.JsonReplyParser;
import com.advotac.assistant.util.LogSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rewrites a legal question into 3-5 statutory search queries.
 *
 * <p>The variants are returned to the caller alongside the answer; retrieval still embeds
 * only the original query. Any failure yields {@code [query]}.</p>
 */
@Component
public class QueryExpander {
    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);
    static final int MAX_VARIANTS = 5;
    static final String SYSTEM_PROMPT = """
            You are a retrieval rewriter for the Advotac Legal AI system.

            Task:
            Rewrite the user's legal question into precise, statutory search queries for the Indian Central Acts dataset.

            Follow these rules:
            1. Extract key legal entities (Act name, section numbers, keywords like "penalty", "benefit", "definition").
            2. Generate 3-5 short expanded queries targeting legal text retrieval.
            3. Prioritize semantic clarity and Indian law context.
            4. Avoid conversational or redundant phrases.

            Output strictly as a JSON list of strings, e.g.:
            ["Section 5 conditions Hindu Marriage Act 1955", "Hindu Marriage Act Section 5 essential conditions", "Conditions for valid Hindu marriage under Indian law"]
            """;
    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    @Value("${advotac.expansion.timeout-ms:8000}")
    private long timeoutMs;
    @Value("${advotac.expansion.cache-size:500}")
    private int cacheSize;
    @Value("${advotac.expansion.cache-ttl-seconds:900}")
    private long cacheTtlSeconds;
    private Cache<String, List<String>> expansionCache;

    public QueryExpander(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        if (this.cacheSize > 0 && this.cacheTtlSeconds > 0) {
            this.expansionCache = Caffeine.newBuilder()
                    .maximumSize(this.cacheSize)
                    .expireAfterWrite(Duration.ofSeconds(this.cacheTtlSeconds))
                    .build();
        }
        log.info("Query expander initialized (timeout={}ms, cache={})", this.timeoutMs, this.expansionCache != null);
    }

    public List<String> expand(String query) {
        if (query == null || query.isBlank()) {
            return List.of(query == null ? "" : query);
        }
        String cacheKey = query.trim().toLowerCase(Locale.ROOT);
        if (this.expansionCache != null) {
            List<String> cached = this.expansionCache.getIfPresent(cacheKey);
            if (cached != null) {
                return cached;
            }
        }
        List<String> variants;
        try {
            String reply = this.completionClient.complete(new CompletionRequest("expand", SYSTEM_PROMPT, query,
                    0.0, 200, Duration.ofMillis(this.timeoutMs)));
            variants = this.parseVariants(reply);
        } catch (RuntimeException e) {
            log.warn("Query expansion failed for {}: {}", LogSanitizer.querySummary(query), LogSanitizer.sanitize(e.getMessage()));
            return List.of(query);
        }
        if (variants.isEmpty()) {
            log.warn("Query expansion reply for {} was not a JSON list of strings", LogSanitizer.querySummary(query));
            return List.of(query);
        }
        if (this.expansionCache != null) {
            this.expansionCache.put(cacheKey, variants);
        }
        log.debug("Expanded {} into {} variants", LogSanitizer.querySummary(query), variants.size());
        return variants;
    }

    List<String> parseVariants(String reply) {
        Optional<JsonNode> array = JsonReplyParser.parseArray(this.objectMapper, reply);
        if (array.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> variants = new ArrayList<>();
        for (JsonNode node : array.get()) {
            if (!node.isTextual()) {
                return List.of();
            }
            String variant = node.asText().trim();
            if (!variant.isEmpty() && seen.add(variant.toLowerCase(Locale.ROOT))) {
                variants.add(variant);
            }
            if (variants.size() >= MAX_VARIANTS) {
                break;
            }
        }
        return List.copyOf(variants);
    }
}
