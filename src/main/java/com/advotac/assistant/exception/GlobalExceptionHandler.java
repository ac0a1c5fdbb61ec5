package com.advotac.assistant.exception;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(RetrievalFailureException.class)
    public ResponseEntity<Map<String, Object>> handleRetrieval(RetrievalFailureException ex) {
        log.warn("Retrieval unavailable: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Statute retrieval is temporarily unavailable");
    }

    @ExceptionHandler(GenerationFailureException.class)
    public ResponseEntity<Map<String, Object>> handleGeneration(GenerationFailureException ex) {
        log.error("Generation failed: {}", ex.getMessage(), ex.getCause());
        return body(HttpStatus.BAD_GATEWAY, "Answer generation failed");
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(RejectedExecutionException ex) {
        log.warn("Request rejected, executor saturated: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Server busy, retry later");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    static String sanitizeExceptionMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Invalid request";
        }
        // no paths, class names or stack fragments
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return "Invalid request";
        }
        return message;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error) {
        return ResponseEntity.status(status).body(Map.of("error", error, "timestamp", Instant.now().toString()));
    }
}
