package com.advotac.assistant.model;

import java.util.Objects;

/**
 * One candidate passage returned by a collection search. Scores below zero are
 * clamped to zero at construction.
 */
public record Hit(double score, String collectionId, HitMetadata metadata) {

    public Hit {
        Objects.requireNonNull(collectionId, "collectionId");
        score = Double.isNaN(score) || score < 0.0 ? 0.0 : score;
        metadata = metadata == null ? HitMetadata.empty() : metadata;
    }
}
