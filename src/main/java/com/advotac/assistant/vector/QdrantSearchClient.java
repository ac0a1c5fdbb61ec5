package com.advotac.assistant.vector;

import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.HitMetadata;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Qdrant REST client for point search.
 *
 * Configuration:
 *   advotac.qdrant.url: http://localhost:6333
 *   advotac.qdrant.api-key: (optional, sent as the {@code api-key} header)
 *   advotac.qdrant.timeout-seconds: 10
 */
@Component
public class QdrantSearchClient implements VectorSearchClient {
    private static final Logger log = LoggerFactory.getLogger(QdrantSearchClient.class);

    private final ObjectMapper objectMapper;
    private RestTemplate restTemplate;

    @Value("${advotac.qdrant.url:http://localhost:6333}")
    private String baseUrl;

    @Value("${advotac.qdrant.api-key:}")
    private String apiKey;

    @Value("${advotac.qdrant.timeout-seconds:10}")
    private int timeoutSeconds;

    public QdrantSearchClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        this.restTemplate = createNoRedirectRestTemplate(this.timeoutSeconds);
        log.info("Qdrant search client initialised (url={}, timeout={}s, apiKey={})",
                this.baseUrl, this.timeoutSeconds, this.apiKey != null && !this.apiKey.isBlank() ? "set" : "none");
    }

    private static RestTemplate createNoRedirectRestTemplate(int timeoutSecs) {
        int timeoutMs = Math.max(1, timeoutSecs) * 1000;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Override
    public List<Hit> search(String collection, float[] vector, int limit) {
        String url = UriComponentsBuilder.fromUriString(this.trimmedBaseUrl())
                .pathSegment("collections", collection, "points", "search")
                .toUriString();
        try {
            String body = this.objectMapper.writeValueAsString(new SearchRequest(vector, limit, true));
            ResponseEntity<String> response = this.restTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(body, this.headers()), String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("Qdrant returned status " + response.getStatusCode() + " for " + collection);
            }
            SearchResponse parsed = this.objectMapper.readValue(response.getBody(), SearchResponse.class);
            List<Hit> hits = new ArrayList<>();
            if (parsed.result != null) {
                for (ScoredPoint point : parsed.result) {
                    hits.add(new Hit(point.score != null ? point.score : 0.0, collection, HitMetadata.fromPayload(point.payload)));
                }
            }
            return hits;
        } catch (IOException e) {
            throw new IllegalStateException("Qdrant response for " + collection + " could not be read", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            ResponseEntity<String> response = this.restTemplate.exchange(this.trimmedBaseUrl() + "/readyz", HttpMethod.GET,
                    new HttpEntity<>(this.headers()), String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (Exception e) {
            log.debug("Qdrant readiness probe failed: {}", e.getMessage());
            return false;
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (this.apiKey != null && !this.apiKey.isBlank()) {
            headers.set("api-key", this.apiKey);
        }
        return headers;
    }

    private String trimmedBaseUrl() {
        return this.baseUrl.endsWith("/") ? this.baseUrl.substring(0, this.baseUrl.length() - 1) : this.baseUrl;
    }

    static final class SearchRequest {
        @JsonProperty("vector")
        public float[] vector;
        @JsonProperty("limit")
        public int limit;
        @JsonProperty("with_payload")
        public boolean withPayload;

        SearchRequest(float[] vector, int limit, boolean withPayload) {
            this.vector = vector;
            this.limit = limit;
            this.withPayload = withPayload;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class SearchResponse {
        @JsonProperty("result")
        public List<ScoredPoint> result;
        @JsonProperty("status")
        public Object status;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ScoredPoint {
        @JsonProperty("id")
        public Object id;
        @JsonProperty("score")
        public Double score;
        @JsonProperty("payload")
        public Map<String, Object> payload;
    }
}
