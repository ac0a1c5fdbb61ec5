package com.advotac.assistant.rag.rerank;

import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.HitMetadata;
import com.advotac.assistant.model.ScoredHit;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Deterministic reranker with no external dependency:
 * {@code alpha * vectorNorm + beta * overlap + gamma * priorBoost}.
 * <ul>
 *   <li>vectorNorm: raw score over the pool maximum</li>
 *   <li>overlap: share of distinct query tokens found in the hit's metadata text</li>
 *   <li>priorBoost: statute-family boost from {@link StatutePriorRules}</li>
 * </ul>
 * Ties keep pool order.
 */
@Component
public class HeuristicReranker {
    private static final Logger log = LoggerFactory.getLogger(HeuristicReranker.class);
    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+");
    private final StatutePriorRules priorRules;
    @Value("${advotac.rerank.heuristic.alpha:0.65}")
    private double alpha = 0.65;
    @Value("${advotac.rerank.heuristic.beta:0.25}")
    private double beta = 0.25;
    @Value("${advotac.rerank.heuristic.gamma:0.10}")
    private double gamma = 0.10;

    public HeuristicReranker(StatutePriorRules priorRules) {
        this.priorRules = priorRules;
    }

    @PostConstruct
    public void init() {
        if (this.alpha < 0.0 || this.beta < 0.0 || this.gamma < 0.0) {
            throw new IllegalStateException("Heuristic rerank weights must be non-negative (alpha=" + this.alpha
                    + ", beta=" + this.beta + ", gamma=" + this.gamma + ")");
        }
        log.info("Heuristic reranker initialized (alpha={}, beta={}, gamma={})", this.alpha, this.beta, this.gamma);
    }

    public List<ScoredHit> rerank(String query, List<Hit> hits) {
        if (hits == null || hits.isEmpty()) {
            return List.of();
        }
        Set<String> queryTokens = tokenize(query);
        double maxScore = hits.stream().mapToDouble(Hit::score).max().orElse(0.0);
        if (maxScore <= 0.0) {
            maxScore = 1.0;
        }
        List<StatutePriorRules.Rule> activeRules = this.priorRules.activeRules(query);
        List<ScoredHit> scored = new ArrayList<>(hits.size());
        for (Hit hit : hits) {
            double vectorNorm = hit.score() / maxScore;
            double overlap = overlap(queryTokens, overlapText(hit.metadata()));
            double prior = this.priorRules.boost(activeRules, hit.metadata());
            scored.add(new ScoredHit(this.combine(vectorNorm, overlap, prior), hit));
        }
        scored.sort(Comparator.comparingDouble(ScoredHit::score).reversed());
        return scored;
    }

    double combine(double vectorNorm, double overlap, double priorBoost) {
        return this.alpha * vectorNorm + this.beta * overlap + this.gamma * priorBoost;
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    static double overlap(Set<String> queryTokens, String text) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> textTokens = tokenize(text);
        if (textTokens.isEmpty()) {
            return 0.0;
        }
        long shared = queryTokens.stream().filter(textTokens::contains).count();
        return (double) shared / (double) queryTokens.size();
    }

    static String overlapText(HitMetadata meta) {
        return Stream.of(meta.title(), meta.heading(), meta.sectionNumber(), meta.breadcrumbs(), meta.text())
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" | "));
    }
}
