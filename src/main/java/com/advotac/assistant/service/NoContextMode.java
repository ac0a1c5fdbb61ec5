package com.advotac.assistant.service;

/**
 * What the pipeline answers when no statutory passage survives retrieval.
 */
public enum NoContextMode {
    /** Fixed "no relevant section" answer, no model call. */
    CANNED,
    /** Fallback generation from the model's own statutory knowledge, flagged as such. */
    GENERAL_KNOWLEDGE
}
