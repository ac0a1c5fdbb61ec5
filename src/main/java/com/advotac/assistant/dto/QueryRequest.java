package com.advotac.assistant.dto;

/**
 * Body of the query endpoints. Missing numeric fields take the pipeline defaults.
 */
public record QueryRequest(String query, Integer topK, Double threshold, Boolean validate) {
    public static final int DEFAULT_TOP_K = 5;
    public static final double DEFAULT_THRESHOLD = 0.70;

    public int topKOrDefault() {
        return this.topK == null ? DEFAULT_TOP_K : this.topK;
    }

    public double thresholdOrDefault() {
        return this.threshold == null ? DEFAULT_THRESHOLD : this.threshold;
    }

    public boolean validateOrDefault() {
        return this.validate == null || this.validate;
    }
}
