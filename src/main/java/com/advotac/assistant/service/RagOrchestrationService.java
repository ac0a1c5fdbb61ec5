package com.advotac.assistant.service;

import com.advotac.assistant.exception.InvalidInputException;
import com.advotac.assistant.model.AnswerResponse;
import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.LayeredContext;
import com.advotac.assistant.model.ScoredHit;
import com.advotac.assistant.model.SourceView;
import com.advotac.assistant.rag.context.ContextBlender;
import com.advotac.assistant.rag.expansion.QueryExpander;
import com.advotac.assistant.rag.generation.AnswerGenerator;
import com.advotac.assistant.rag.layer.LayerClassifier;
import com.advotac.assistant.rag.rerank.HeuristicReranker;
import com.advotac.assistant.rag.rerank.ModelReranker;
import com.advotac.assistant.rag.validation.CitationValidator;
import com.advotac.assistant.util.LogSanitizer;
import com.advotac.assistant.vector.MultiCollectionSearcher;
import com.advotac.assistant.vector.QueryEmbeddingService;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Single pipeline entry point: expand, embed, search, rerank, filter, blend, generate and
 * optionally validate. Callers choose the collection list; every stage is an injected seam.
 */
@Service
public class RagOrchestrationService {
    private static final Logger log = LoggerFactory.getLogger(RagOrchestrationService.class);
    public static final String NO_CONTEXT_ANSWER = "No directly relevant section found in the available Acts.";
    private final QueryExpander queryExpander;
    private final QueryEmbeddingService embeddingService;
    private final MultiCollectionSearcher searcher;
    private final ModelReranker modelReranker;
    private final HeuristicReranker heuristicReranker;
    private final ContextBlender contextBlender;
    private final LayerClassifier layerClassifier;
    private final AnswerGenerator answerGenerator;
    private final CitationValidator citationValidator;
    private final AtomicInteger queryCount = new AtomicInteger(0);
    private final AtomicLong totalLatencyMs = new AtomicLong(0);
    @Value("${advotac.retrieval.collections:advotac_acts_L1,advotac_acts_L2,advotac_acts_L3}")
    private List<String> defaultCollections = List.of("advotac_acts_L1", "advotac_acts_L2", "advotac_acts_L3");
    @Value("${advotac.retrieval.min-candidates:15}")
    private int minCandidates = 15;
    @Value("${advotac.retrieval.candidate-multiplier:8}")
    private int candidateMultiplier = 8;
    @Value("${advotac.pipeline.no-context-mode:CANNED}")
    private NoContextMode noContextMode = NoContextMode.CANNED;

    public RagOrchestrationService(QueryExpander queryExpander, QueryEmbeddingService embeddingService,
            MultiCollectionSearcher searcher, ModelReranker modelReranker, HeuristicReranker heuristicReranker,
            ContextBlender contextBlender, LayerClassifier layerClassifier, AnswerGenerator answerGenerator,
            CitationValidator citationValidator) {
        this.queryExpander = queryExpander;
        this.embeddingService = embeddingService;
        this.searcher = searcher;
        this.modelReranker = modelReranker;
        this.heuristicReranker = heuristicReranker;
        this.contextBlender = contextBlender;
        this.layerClassifier = layerClassifier;
        this.answerGenerator = answerGenerator;
        this.citationValidator = citationValidator;
    }

    public AnswerResponse answerQuery(String query, int topK, double threshold, boolean validate) {
        return this.answerQuery(query, topK, threshold, validate, this.defaultCollections);
    }

    public AnswerResponse answerQuery(String query, int topK, double threshold, boolean validate, List<String> collections) {
        String normalized = validateInput(query, topK, threshold);
        if (collections == null || collections.isEmpty()) {
            throw new InvalidInputException("At least one collection is required");
        }
        long start = System.currentTimeMillis();
        try {
            return this.run(normalized, topK, threshold, validate, collections);
        } finally {
            this.totalLatencyMs.addAndGet(System.currentTimeMillis() - start);
            this.queryCount.incrementAndGet();
        }
    }

    private AnswerResponse run(String query, int topK, double threshold, boolean validate, List<String> collections) {
        String summary = LogSanitizer.querySummary(query);
        List<String> expanded = this.queryExpander.expand(query);

        float[] vector = this.embeddingService.embed(query);
        int limit = candidateLimit(topK, this.minCandidates, this.candidateMultiplier);
        List<Hit> candidates = this.searcher.search(vector, limit, collections);
        log.info("Retrieved {} candidates for {} from {} collection(s)", candidates.size(), summary, collections.size());
        if (candidates.isEmpty()) {
            return this.noContext(query, topK, expanded, List.of(), candidates);
        }

        List<ScoredHit> ranked = this.modelReranker.rerank(query, candidates);
        String path = "model";
        if (ranked.isEmpty()) {
            log.warn("Model rerank unavailable for {}, using heuristic ranking", summary);
            ranked = this.heuristicReranker.rerank(query, candidates);
            path = "heuristic";
        }
        List<ScoredHit> base = applyThreshold(ranked, threshold);
        log.info("Rerank path={} ranked={} kept={} thresholdFallback={}", path, ranked.size(), base.size(), base == ranked);

        List<ScoredHit> selected = this.contextBlender.select(base, topK);
        LayeredContext context = this.contextBlender.serialize(selected);
        if (context.isEmpty()) {
            return this.noContext(query, topK, expanded, selected, candidates);
        }

        String answer = this.answerGenerator.generate(query, context);
        String verdict = validate ? this.citationValidator.validate(answer, context) : null;
        log.info("Answered {} with {} context blocks ({} chars)", summary, context.blockCount(), context.totalChars());
        return new AnswerResponse(query, answer, expanded, this.toSources(selected), verdict);
    }

    private AnswerResponse noContext(String query, int topK, List<String> expanded, List<ScoredHit> selected, List<Hit> candidates) {
        log.info("No statutory context for {} (mode={})", LogSanitizer.querySummary(query), this.noContextMode);
        List<SourceView> sources;
        if (!selected.isEmpty()) {
            sources = this.toSources(selected);
        } else {
            sources = new ArrayList<>();
            for (Hit hit : candidates.subList(0, Math.min(topK, candidates.size()))) {
                sources.add(SourceView.of(hit, this.layerClassifier.classify(hit)));
            }
        }
        String answer = this.noContextMode == NoContextMode.GENERAL_KNOWLEDGE
                ? this.answerGenerator.generateWithoutContext(query)
                : NO_CONTEXT_ANSWER;
        return new AnswerResponse(query, answer, expanded, sources, null);
    }

    /**
     * Keeps hits whose vector similarity reaches {@code threshold}; returns {@code ranked}
     * itself when nothing passes.
     */
    static List<ScoredHit> applyThreshold(List<ScoredHit> ranked, double threshold) {
        List<ScoredHit> passed = new ArrayList<>();
        for (ScoredHit scored : ranked) {
            if (scored.hit().score() >= threshold) {
                passed.add(scored);
            }
        }
        return passed.isEmpty() ? ranked : passed;
    }

    static int candidateLimit(int topK, int minCandidates, int multiplier) {
        long wanted = (long) topK * multiplier;
        return (int) Math.max(minCandidates, Math.min(Integer.MAX_VALUE, wanted));
    }

    private List<SourceView> toSources(List<ScoredHit> selected) {
        List<SourceView> sources = new ArrayList<>(selected.size());
        for (ScoredHit scored : selected) {
            sources.add(SourceView.of(scored.hit(), this.layerClassifier.classify(scored.hit())));
        }
        return sources;
    }

    static String validateInput(String query, int topK, double threshold) {
        if (query == null || query.isBlank()) {
            throw new InvalidInputException("Query must not be empty");
        }
        if (topK <= 0) {
            throw new InvalidInputException("topK must be greater than zero");
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new InvalidInputException("threshold must be between 0 and 1");
        }
        return query.trim();
    }

    public int getQueryCount() {
        return this.queryCount.get();
    }

    public long getAverageLatencyMs() {
        int count = this.queryCount.get();
        return count == 0 ? 0 : this.totalLatencyMs.get() / count;
    }

    public List<String> getDefaultCollections() {
        return this.defaultCollections;
    }
}
