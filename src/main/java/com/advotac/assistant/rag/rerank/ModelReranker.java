package com.advotac.assistant.rag.rerank;

import com.advotac.assistant.llm.CompletionClient;
import com.advotac.assistant.llm.CompletionRequest;
import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.ScoredHit;
import com.advotac.assistant.rag.context.ContextBlender;
import com.advotac.assistant.rag.layer.LayerClassifier;
import com.advotac.assistant.util.JsonReplyParser;
import com.advotac.assistant.util.LogSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Asks the generative model to score up to {@code maxCandidates} hits for legal relevance.
 *
 * <p>Returns hits sorted by model score, or an empty list when the call fails, times out,
 * or the reply is not a JSON list of {@code {id, score}} rows. Rows whose id does not point
 * at a submitted candidate are dropped. Repeated failures pause the model so later queries
 * go straight to the heuristic path for a while.</p>
 */
@Component
public class ModelReranker {
    private static final Logger log = LoggerFactory.getLogger(ModelReranker.class);
    static final String SYSTEM_PROMPT = """
            You are a legal reranker.
            You are given retrieved context chunks from three hierarchical layers:
            - L1: Part/Chapter titles
            - L2: Sections (main provisions)
            - L3: Clauses/paragraphs (fine details)

            Goal: Rank them by legal relevance to the question.

            Rules:
            1. Prefer L3 chunks that contain direct answers or definitions.
            2. Use L2 chunks for supportive explanations or related sections.
            3. Use L1 only for hierarchical relevance.
            4. Penalize duplicates or context-only text without rules.
            5. Prioritize chunks that include explicit section numbers or clause references,
               and legal verbs such as "shall", "may", "liable", "entitled".

            Output: a JSON array only, one object per relevant chunk, with a numeric relevance
            score between 0 and 1 and a short reason. Example:
            [{"layer":"L3","id":0,"score":0.96,"reason":"Defines supply under Section 7 CGST"},
             {"layer":"L2","id":3,"score":0.82,"reason":"Section text elaborating the same rule"},
             {"layer":"L1","id":6,"score":0.55,"reason":"Heading context only"}]
            """;
    private final CompletionClient completionClient;
    private final LayerClassifier layerClassifier;
    private final ObjectMapper objectMapper;
    @Value("${advotac.rerank.model.enabled:true}")
    private boolean enabled;
    @Value("${advotac.rerank.model.max-candidates:24}")
    private int maxCandidates;
    @Value("${advotac.rerank.model.max-text-chars:1200}")
    private int maxTextChars;
    @Value("${advotac.rerank.model.timeout-ms:20000}")
    private long timeoutMs;
    @Value("${advotac.rerank.model.failure-threshold:3}")
    private int failureThreshold;
    @Value("${advotac.rerank.model.open-seconds:60}")
    private long openSeconds;
    private RerankBackoff backoff;

    public ModelReranker(CompletionClient completionClient, LayerClassifier layerClassifier, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.layerClassifier = layerClassifier;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        this.backoff = new RerankBackoff(this.failureThreshold, Duration.ofSeconds(this.openSeconds), Clock.systemUTC());
        log.info("Model reranker initialized (enabled={}, maxCandidates={}, timeout={}ms)", this.enabled, this.maxCandidates, this.timeoutMs);
    }

    public List<ScoredHit> rerank(String query, List<Hit> hits) {
        if (!this.enabled || hits == null || hits.isEmpty()) {
            return List.of();
        }
        if (!this.backoff.tryAcquire()) {
            log.debug("Model reranker paused; skipping");
            return List.of();
        }
        List<Hit> candidates = hits.subList(0, Math.min(Math.max(1, this.maxCandidates), hits.size()));
        try {
            String reply = this.completionClient.complete(new CompletionRequest("rerank", SYSTEM_PROMPT,
                    this.buildUserPrompt(query, candidates), 0.0, 700, Duration.ofMillis(this.timeoutMs)));
            List<ScoredHit> scored = this.parse(reply, candidates);
            if (scored.isEmpty()) {
                log.warn("Model reranker reply held no usable rows: {}", LogSanitizer.sanitize(reply));
                this.recordFailure();
                return List.of();
            }
            if (this.backoff.onSuccess()) {
                log.info("Model reranker resumed");
            }
            return scored;
        } catch (RuntimeException e) {
            log.warn("Model reranking failed: {}", LogSanitizer.sanitize(e.getMessage()));
            this.recordFailure();
            return List.of();
        }
    }

    private void recordFailure() {
        if (this.backoff.onFailure()) {
            log.warn("Model reranker paused for {}s after repeated failures", this.backoff.pause().toSeconds());
        }
    }

    String buildUserPrompt(String query, List<Hit> candidates) {
        List<Map<String, Object>> items = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Hit hit = candidates.get(i);
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", i);
            item.put("layer", this.layerClassifier.classify(hit).name());
            item.put("meta", ContextBlender.metaLine(hit.metadata()));
            String text = hit.metadata().textOrEmpty();
            item.put("text", text.length() > this.maxTextChars ? text.substring(0, this.maxTextChars) : text);
            items.add(item);
        }
        try {
            return "Question:\n" + query + "\n\nChunks:\n" + this.objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Rerank candidates could not be serialized", e);
        }
    }

    List<ScoredHit> parse(String reply, List<Hit> candidates) {
        Optional<JsonNode> rows = JsonReplyParser.parseArray(this.objectMapper, reply);
        if (rows.isEmpty()) {
            return List.of();
        }
        Set<Integer> seen = new HashSet<>();
        List<ScoredHit> scored = new ArrayList<>();
        for (JsonNode row : rows.get()) {
            if (!row.isObject() || !row.hasNonNull("id") || !row.hasNonNull("score")) {
                continue;
            }
            Integer idx = candidateIndex(row.get("id"));
            JsonNode scoreNode = row.get("score");
            if (idx == null || !(scoreNode.isNumber() || scoreNode.isTextual())) {
                continue;
            }
            double score = scoreNode.asDouble(Double.NaN);
            if (idx < 0 || idx >= candidates.size() || Double.isNaN(score) || !seen.add(idx)) {
                continue;
            }
            scored.add(new ScoredHit(Math.max(0.0, Math.min(1.0, score)), candidates.get(idx)));
            if (log.isDebugEnabled() && row.hasNonNull("reason")) {
                log.debug("Rerank id={} score={} reason={}", idx, score, LogSanitizer.sanitize(row.get("reason").asText()));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredHit::score).reversed());
        return scored;
    }

    private static Integer candidateIndex(JsonNode idNode) {
        if (idNode.isIntegralNumber() && idNode.canConvertToInt()) {
            return idNode.intValue();
        }
        if (idNode.isTextual()) {
            try {
                return Integer.parseInt(idNode.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    RerankBackoff backoff() {
        return this.backoff;
    }
}
