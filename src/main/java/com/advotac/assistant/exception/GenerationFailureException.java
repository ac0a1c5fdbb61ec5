package com.advotac.assistant.exception;

/**
 * The answer generator could not produce an answer.
 */
public class GenerationFailureException extends RuntimeException {
    public GenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
