package com.advotac.assistant.llm;

/**
 * A single generative-model call failed, timed out, or returned nothing.
 */
public class ModelCallException extends RuntimeException {
    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
