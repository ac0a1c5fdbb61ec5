package com.advotac.assistant;

import com.advotac.assistant.service.NoContextMode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class AdvotacAssistantApplication {
    private static final Logger log = LoggerFactory.getLogger(AdvotacAssistantApplication.class);
    private final Environment environment;

    public AdvotacAssistantApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(AdvotacAssistantApplication.class, args);
    }

    @PostConstruct
    public void logPipelineConfiguration() {
        String mode = this.environment.getProperty("advotac.pipeline.no-context-mode", "CANNED");
        try {
            NoContextMode.valueOf(mode.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("advotac.pipeline.no-context-mode must be CANNED or GENERAL_KNOWLEDGE, got: " + mode, e);
        }
        log.info("=== Advotac pipeline configuration ===");
        log.info("  Qdrant URL: {}", this.environment.getProperty("advotac.qdrant.url", "http://localhost:6333"));
        log.info("  Layered collections: {}", this.environment.getProperty("advotac.retrieval.collections", ""));
        log.info("  Single collection: {}", this.environment.getProperty("advotac.retrieval.single-collection", ""));
        log.info("  Chat model: {}", this.environment.getProperty("spring.ai.ollama.chat.options.model", "(provider default)"));
        log.info("  Embedding model: {}", this.environment.getProperty("spring.ai.ollama.embedding.options.model", "(provider default)"));
        log.info("  Model rerank enabled: {}", this.environment.getProperty("advotac.rerank.model.enabled", "true"));
        log.info("  No-context mode: {}", mode);
        log.info("======================================");
    }
}
