package com.advotac.assistant.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON array out of a model reply. Models wrap JSON in markdown fences or add a
 * sentence before it, so the outermost {@code [...]} span is parsed when the whole reply
 * is not valid JSON.
 */
public final class JsonReplyParser {
    private static final Pattern FENCE = Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

    private JsonReplyParser() {
    }

    public static Optional<JsonNode> parseArray(ObjectMapper mapper, String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String body = reply.trim();
        Matcher fence = FENCE.matcher(body);
        if (fence.matches()) {
            body = fence.group(1).trim();
        }
        Optional<JsonNode> direct = tryRead(mapper, body);
        if (direct.isPresent()) {
            return direct;
        }
        int start = body.indexOf('[');
        int end = body.lastIndexOf(']');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return tryRead(mapper, body.substring(start, end + 1));
    }

    private static Optional<JsonNode> tryRead(ObjectMapper mapper, String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            return node != null && node.isArray() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
