package com.advotac.assistant.exception;

/**
 * The embedding service or every vector collection was unavailable.
 */
public class RetrievalFailureException extends RuntimeException {
    public RetrievalFailureException(String message) {
        super(message);
    }

    public RetrievalFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
