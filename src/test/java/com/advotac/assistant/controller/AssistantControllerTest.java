package com.advotac.assistant.controller;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.advotac.assistant.exception.GenerationFailureException;
import com.advotac.assistant.exception.InvalidInputException;
import com.advotac.assistant.exception.RetrievalFailureException;
import com.advotac.assistant.model.AnswerResponse;
import com.advotac.assistant.model.Layer;
import com.advotac.assistant.model.SourceView;
import com.advotac.assistant.service.RagOrchestrationService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AssistantController.class)
class AssistantControllerTest {
    private static final List<String> LAYERED = List.of("advotac_acts_L1", "advotac_acts_L2", "advotac_acts_L3");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RagOrchestrationService ragService;

    @BeforeEach
    void setUp() {
        when(ragService.getDefaultCollections()).thenReturn(LAYERED);
    }

    @Test
    void singleCollectionEndpointUsesDefaultsAndFlatCollection() throws Exception {
        when(ragService.answerQuery(eq("Section 302 IPC"), eq(5), eq(0.70), eq(true), eq(List.of("central_acts_v2"))))
                .thenReturn(new AnswerResponse("Section 302 IPC", "Death or imprisonment for life.",
                        List.of("IPC 302 punishment"),
                        List.of(new SourceView("central_acts_v2", 0.91, Layer.L2, "The Indian Penal Code, 1860", "302",
                                "Punishment for murder", null, "ipc-302", "Whoever commits murder...")),
                        "Verified"));

        mockMvc.perform(post("/api/assistant/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"Section 302 IPC\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Death or imprisonment for life."))
                .andExpect(jsonPath("$.expandedQueries[0]").value("IPC 302 punishment"))
                .andExpect(jsonPath("$.sources[0].layer").value("L2"))
                .andExpect(jsonPath("$.sources[0].sectionNumber").value("302"))
                .andExpect(jsonPath("$.validation").value("Verified"));
    }

    @Test
    void layeredEndpointPassesRequestOptions() throws Exception {
        when(ragService.answerQuery(anyString(), anyInt(), anyDouble(), anyBoolean(), anyList()))
                .thenReturn(new AnswerResponse("q", "a", List.of(), List.of(), null));

        mockMvc.perform(post("/api/assistant/query-v2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"bail\",\"topK\":3,\"threshold\":0.5,\"validate\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expandedQueries[0]").value("q"));

        verify(ragService).answerQuery("bail", 3, 0.5, false, LAYERED);
    }

    @Test
    void invalidInputIs400() throws Exception {
        when(ragService.answerQuery(anyString(), anyInt(), anyDouble(), anyBoolean(), anyList()))
                .thenThrow(new InvalidInputException("topK must be greater than zero"));

        mockMvc.perform(post("/api/assistant/query-v2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"bail\",\"topK\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("topK must be greater than zero"));
    }

    @Test
    void malformedBodyIs400() throws Exception {
        mockMvc.perform(post("/api/assistant/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void retrievalFailureIs503() throws Exception {
        when(ragService.answerQuery(anyString(), anyInt(), anyDouble(), anyBoolean(), anyList()))
                .thenThrow(new RetrievalFailureException("Vector search failed in all 3 collection(s)"));

        mockMvc.perform(post("/api/assistant/query-v2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"bail\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Statute retrieval is temporarily unavailable"));
    }

    @Test
    void generationFailureIs502() throws Exception {
        when(ragService.answerQuery(anyString(), anyInt(), anyDouble(), anyBoolean(), anyList()))
                .thenThrow(new GenerationFailureException("Failed to generate answer", new IllegalStateException("boom")));

        mockMvc.perform(post("/api/assistant/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"bail\"}"))
                .andExpect(status().isBadGateway());
    }
}
