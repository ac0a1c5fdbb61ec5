package com.advotac.assistant.exception;

/**
 * Caller supplied arguments the pipeline cannot run with. Never retried.
 */
public class InvalidInputException extends IllegalArgumentException {
    public InvalidInputException(String message) {
        super(message);
    }
}
