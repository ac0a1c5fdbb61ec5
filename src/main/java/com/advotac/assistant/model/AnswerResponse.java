package com.advotac.assistant.model;

import java.util.List;
import org.springframework.lang.Nullable;

/**
 * Result of one pipeline run.
 *
 * @param query the normalized query
 * @param answer generated answer, or the canned no-context answer
 * @param expandedQueries alternative phrasings; never empty
 * @param sources hits the answer was grounded on, at most {@code topK}
 * @param validation citation verdict, validator error marker, or {@code null} when skipped
 */
public record AnswerResponse(
        String query,
        String answer,
        List<String> expandedQueries,
        List<SourceView> sources,
        @Nullable String validation) {

    public AnswerResponse {
        expandedQueries = expandedQueries == null || expandedQueries.isEmpty() ? List.of(query) : List.copyOf(expandedQueries);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
