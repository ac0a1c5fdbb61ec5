package com.advotac.assistant.controller;

import com.advotac.assistant.dto.QueryRequest;
import com.advotac.assistant.exception.InvalidInputException;
import com.advotac.assistant.model.AnswerResponse;
import com.advotac.assistant.service.RagOrchestrationService;
import com.advotac.assistant.util.LogSanitizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/assistant")
public class AssistantController {
    private static final Logger log = LoggerFactory.getLogger(AssistantController.class);
    private final RagOrchestrationService ragService;
    @Value("${advotac.retrieval.single-collection:central_acts_v2}")
    private String singleCollection = "central_acts_v2";

    public AssistantController(RagOrchestrationService ragService) {
        this.ragService = ragService;
    }

    /**
     * Single-collection profile over the flat statute index.
     */
    @PostMapping("/query")
    public AnswerResponse query(@RequestBody(required = false) QueryRequest request) {
        return this.answer("query", request, List.of(this.singleCollection));
    }

    /**
     * Layered profile: searches the configured L1/L2/L3 collections in parallel.
     */
    @PostMapping("/query-v2")
    public AnswerResponse queryLayered(@RequestBody(required = false) QueryRequest request) {
        return this.answer("query-v2", request, this.ragService.getDefaultCollections());
    }

    private AnswerResponse answer(String endpoint, QueryRequest request, List<String> collections) {
        if (request == null) {
            throw new InvalidInputException("Request body is required");
        }
        long start = System.currentTimeMillis();
        AnswerResponse response = this.ragService.answerQuery(request.query(), request.topKOrDefault(),
                request.thresholdOrDefault(), request.validateOrDefault(), collections);
        log.info("/{} answered {} in {}ms ({} sources)", endpoint, LogSanitizer.querySummary(request.query()),
                System.currentTimeMillis() - start, response.sources().size());
        return response;
    }
}
