package com.advotac.assistant.model;

/**
 * A hit paired with the score a reranker assigned to it. The hit's own vector
 * score is left untouched.
 */
public record ScoredHit(double score, Hit hit) {

    public static ScoredHit ofVectorScore(Hit hit) {
        return new ScoredHit(hit.score(), hit);
    }
}
