package com.advotac.assistant.rag.validation;

import com.advotac.assistant.llm.CompletionClient;
import com.advotac.assistant.llm.CompletionRequest;
import com.advotac.assistant.model.LayeredContext;
import com.advotac.assistant.util.LogSanitizer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Advisory check that the Acts and sections cited in an answer appear in the retrieved
 * context. Never changes the answer; a failed check becomes an inline error marker.
 */
@Component
public class CitationValidator {
    private static final Logger log = LoggerFactory.getLogger(CitationValidator.class);
    public static final String ERROR_PREFIX = "(validator error: ";
    static final String SYSTEM_PROMPT = """
            You are a legal citation validator for Indian Acts.
            Input includes an answer text with citations.

            Task:
            Check that every section, sub-section, and Act name mentioned exists in the retrieved context or in the official statute structure.

            Output:
            - "Verified" if all match.
            - "Possibly inaccurate" followed by the suggested correct citation.

            Never modify meaning, only validate.
            """;
    private final CompletionClient completionClient;
    @Value("${advotac.validation.timeout-ms:20000}")
    private long timeoutMs;

    public CitationValidator(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    public String validate(String answer, LayeredContext context) {
        String user = "Answer:\n" + answer + "\n\nRetrieved Context:\n"
                + "L1: " + orNone(context.l1()) + "\n"
                + "L2: " + orNone(context.l2()) + "\n"
                + "L3: " + orNone(context.l3());
        try {
            return this.completionClient.complete(new CompletionRequest("validate", SYSTEM_PROMPT, user,
                    0.0, 200, Duration.ofMillis(this.timeoutMs)));
        } catch (RuntimeException e) {
            log.warn("Citation validation degraded: {}", LogSanitizer.sanitize(e.getMessage()));
            return ERROR_PREFIX + e.getMessage() + ")";
        }
    }

    private static String orNone(String bucket) {
        return bucket == null || bucket.isBlank() ? "[none]" : bucket;
    }
}
