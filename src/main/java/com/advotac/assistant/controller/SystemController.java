package com.advotac.assistant.controller;

import com.advotac.assistant.service.RagOrchestrationService;
import com.advotac.assistant.vector.VectorSearchClient;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SystemController {
    private final VectorSearchClient vectorSearchClient;
    private final RagOrchestrationService ragService;

    public SystemController(VectorSearchClient vectorSearchClient, RagOrchestrationService ragService) {
        this.vectorSearchClient = vectorSearchClient;
        this.ragService = ragService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean online = this.vectorSearchClient.isAvailable();
        return ResponseEntity.status(online ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", online ? "UP" : "DOWN", "vectorDb", online ? "ONLINE" : "OFFLINE"));
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of("queries", this.ragService.getQueryCount(),
                "avgLatency", this.ragService.getAverageLatencyMs() + "ms",
                "collections", this.ragService.getDefaultCollections());
    }
}
