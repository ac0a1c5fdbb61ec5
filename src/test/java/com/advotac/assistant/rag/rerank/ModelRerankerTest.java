package com.advotac.assistant.rag.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.advotac.assistant.llm.CompletionClient;
import com.advotac.assistant.llm.CompletionRequest;
import com.advotac.assistant.llm.ModelCallException;
import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.HitMetadata;
import com.advotac.assistant.model.ScoredHit;
import com.advotac.assistant.rag.layer.LayerClassifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

class ModelRerankerTest {
    private CompletionClient completionClient;
    private ModelReranker reranker;
    private List<Hit> hits;

    @BeforeEach
    void setUp() {
        completionClient = mock(CompletionClient.class);
        reranker = new ModelReranker(completionClient, new LayerClassifier(), new ObjectMapper());
        ReflectionTestUtils.setField(reranker, "enabled", true);
        ReflectionTestUtils.setField(reranker, "maxCandidates", 3);
        ReflectionTestUtils.setField(reranker, "maxTextChars", 20);
        ReflectionTestUtils.setField(reranker, "timeoutMs", 1000L);
        ReflectionTestUtils.setField(reranker, "failureThreshold", 2);
        ReflectionTestUtils.setField(reranker, "openSeconds", 60L);
        reranker.init();
        hits = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            hits.add(new Hit(0.9 - i * 0.05, "advotac_acts_L2", new HitMetadata("Act " + i, String.valueOf(i), null, null,
                    null, null, null, "text of section " + i + " which is quite long indeed", null, Map.of())));
        }
    }

    @Test
    void ordersByModelScore() {
        when(completionClient.complete(any())).thenReturn(
                "[{\"id\":0,\"score\":0.4},{\"id\":2,\"score\":0.95,\"reason\":\"direct rule\"},{\"id\":1,\"score\":0.7}]");

        List<ScoredHit> ranked = reranker.rerank("query", hits);

        assertThat(ranked).extracting(ScoredHit::hit).containsExactly(hits.get(2), hits.get(1), hits.get(0));
        assertThat(ranked.get(0).score()).isEqualTo(0.95);
    }

    @Test
    void dropsBadRowsClampsScoresAndKeepsFirstDuplicate() {
        when(completionClient.complete(any())).thenReturn("""
                ```json
                [{"id":1,"score":1.7},{"id":1,"score":0.1},{"id":7,"score":0.9},{"id":"0","score":"0.5"},
                 {"id":2.5,"score":0.9},{"id":2,"score":"high"},"junk"]
                ```""");

        List<ScoredHit> ranked = reranker.rerank("query", hits);

        assertThat(ranked).extracting(ScoredHit::hit).containsExactly(hits.get(1), hits.get(0));
        assertThat(ranked).extracting(ScoredHit::score).containsExactly(1.0, 0.5);
    }

    @Test
    void sendsOnlyCappedCandidatesWithTruncatedText() {
        when(completionClient.complete(any())).thenReturn("[{\"id\":0,\"score\":0.5}]");
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);

        reranker.rerank("bail conditions", hits);

        verify(completionClient).complete(captor.capture());
        String prompt = captor.getValue().userPrompt();
        assertThat(prompt).contains("bail conditions").contains("\"id\":2").doesNotContain("\"id\":3");
        assertThat(prompt).contains("\"layer\":\"L2\"").contains("Act 0 | Section 0");
        assertThat(prompt).doesNotContain("quite long indeed");
    }

    @Test
    void returnsEmptyOnUnusableReplyOrFailure() {
        when(completionClient.complete(any())).thenReturn("I cannot rank these.");
        assertThat(reranker.rerank("query", hits)).isEmpty();

        when(completionClient.complete(any())).thenThrow(new ModelCallException("rerank call timed out"));
        assertThat(reranker.rerank("query", hits)).isEmpty();
    }

    @Test
    void pausesAfterRepeatedFailures() {
        when(completionClient.complete(any())).thenThrow(new ModelCallException("down"));

        reranker.rerank("query", hits);
        reranker.rerank("query", hits);
        assertThat(reranker.backoff().isPaused()).isTrue();

        assertThat(reranker.rerank("query", hits)).isEmpty();
        verify(completionClient, times(2)).complete(any());
    }

    @Test
    void disabledSkipsModel() {
        ReflectionTestUtils.setField(reranker, "enabled", false);

        assertThat(reranker.rerank("query", hits)).isEmpty();
        verify(completionClient, never()).complete(any());
    }
}
