package com.advotac.assistant.rag.generation;

import com.advotac.assistant.exception.GenerationFailureException;
import com.advotac.assistant.llm.CompletionClient;
import com.advotac.assistant.llm.CompletionRequest;
import com.advotac.assistant.model.LayeredContext;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes the final answer in the six-part statutory format.
 *
 * <p>{@link #generate} grounds the answer in the layered context, clause detail first.
 * {@link #generateWithoutContext} is the explicit no-context mode: the model answers from its
 * own statutory knowledge and the reply is prefixed with {@link #NO_CONTEXT_NOTICE}.</p>
 */
@Component
public class AnswerGenerator {
    private static final Logger log = LoggerFactory.getLogger(AnswerGenerator.class);
    public static final String NO_CONTEXT_NOTICE =
            "[General knowledge answer: no statutory passages were retrieved for this question.]";
    static final String ANSWER_FORMAT = """
            ---
            1. **Section & Act Name:**
            2. **Core Rule(s):**
            3. **Key Provisos / Exceptions / Definitions:**
            4. **Penalty / Procedure / Remedies:**
            5. **Drafting / Practical Notes:**
            6. **Final Citation (Act -> Chapter -> Section -> Clause):**
            ---
            """;
    static final String SYSTEM_PROMPT = """
            You are Advotac Legal AI, a precision-based assistant trained on Indian Acts (L1-L3 hierarchy).

            Use the retrieved context to answer accurately under Indian law.
            Prioritize exact statutory wording, clarity, and verified citations.
            """;
    static final String FALLBACK_SYSTEM_PROMPT = """
            You are Advotac Legal AI, an authoritative assistant on Indian central statutes.
            When retrieval context is unavailable, rely on your statutory knowledge to answer precisely.
            Cite the relevant Act and section explicitly. If genuinely uncertain, only then say
            "No directly relevant section found."
            """;
    private final CompletionClient completionClient;
    @Value("${advotac.generation.timeout-ms:60000}")
    private long timeoutMs;
    @Value("${advotac.generation.temperature:0.1}")
    private double temperature;
    @Value("${advotac.generation.max-tokens:900}")
    private int maxTokens;

    public AnswerGenerator(CompletionClient completionClient) {
        this.completionClient = completionClient;
    }

    public String generate(String query, LayeredContext context) {
        return this.complete("generate", SYSTEM_PROMPT, buildUserPrompt(query, context));
    }

    public String generateWithoutContext(String query) {
        String prompt = "No contextual passages were retrieved. Using the best of your legal knowledge, respond to:\n"
                + query + "\n\nFollow the canonical format:\n" + ANSWER_FORMAT;
        return NO_CONTEXT_NOTICE + "\n\n" + this.complete("generate-fallback", FALLBACK_SYSTEM_PROMPT, prompt);
    }

    static String buildUserPrompt(String query, LayeredContext context) {
        return "Context:\n"
                + "L3 (Clauses): " + orNone(context.l3()) + "\n"
                + "L2 (Sections): " + orNone(context.l2()) + "\n"
                + "L1 (Navigation): " + orNone(context.l1()) + "\n\n"
                + "Question: " + query + "\n\n"
                + """
                Instructions:
                1. Accuracy is the highest priority. If the answer isn't clearly found, say:
                   "No directly relevant section found in the available Acts."
                2. Quote exact legal text from L2/L3 where possible.
                3. Always mention the section number and name, the Act name and year, and the
                   sub-section or clause if applicable.
                4. Explain the rule in plain legal English.
                5. Use this output format:
                """
                + ANSWER_FORMAT
                + """

                Rules:
                - Never invent law or cite outside retrieved Acts.
                - If multiple Acts overlap, list them separately.
                - Use concise statutory English; avoid speculation.
                """;
    }

    private String complete(String purpose, String system, String user) {
        try {
            return this.completionClient.complete(new CompletionRequest(purpose, system, user,
                    this.temperature, this.maxTokens, Duration.ofMillis(this.timeoutMs)));
        } catch (RuntimeException e) {
            log.error("Answer generation ({}) failed: {}", purpose, e.getMessage());
            throw new GenerationFailureException("Failed to generate answer from the language model", e);
        }
    }

    static String orNone(String bucket) {
        return bucket == null || bucket.isBlank() ? "[none]" : bucket;
    }
}
