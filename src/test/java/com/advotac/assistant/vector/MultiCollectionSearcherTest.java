package com.advotac.assistant.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.advotac.assistant.exception.RetrievalFailureException;
import com.advotac.assistant.model.Hit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class MultiCollectionSearcherTest {
    private ExecutorService executor;
    private FakeSearchClient searchClient;
    private MultiCollectionSearcher searcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        searchClient = new FakeSearchClient();
        searcher = new MultiCollectionSearcher(searchClient, executor);
        ReflectionTestUtils.setField(searcher, "searchTimeoutMs", 500L);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void poolsAndSortsAcrossCollections() {
        searchClient.results.put("acts_L1", List.of(hit(0.60, "acts_L1"), hit(0.40, "acts_L1")));
        searchClient.results.put("acts_L2", List.of(hit(0.90, "acts_L2")));
        searchClient.results.put("acts_L3", List.of(hit(0.75, "acts_L3")));

        List<Hit> hits = searcher.search(new float[]{1f}, 40, List.of("acts_L1", "acts_L2", "acts_L3"));

        assertThat(hits).extracting(Hit::score).containsExactly(0.90, 0.75, 0.60, 0.40);
        assertThat(searchClient.limits.values()).containsOnly(40);
    }

    @Test
    void failingCollectionIsSkipped() {
        searchClient.results.put("acts_L1", List.of(hit(0.60, "acts_L1")));
        searchClient.failing.put("acts_L2", true);

        List<Hit> hits = searcher.search(new float[]{1f}, 15, List.of("acts_L1", "acts_L2"));

        assertThat(hits).extracting(Hit::collectionId).containsExactly("acts_L1");
    }

    @Test
    void slowCollectionTimesOutWithoutFailingOthers() {
        searchClient.results.put("acts_L1", List.of(hit(0.60, "acts_L1")));
        searchClient.delayMs.put("acts_L3", 3000L);

        List<Hit> hits = searcher.search(new float[]{1f}, 15, List.of("acts_L1", "acts_L3"));

        assertThat(hits).hasSize(1);
    }

    @Test
    void allCollectionsFailingRaisesRetrievalFailure() {
        searchClient.failing.put("acts_L1", true);
        searchClient.failing.put("acts_L2", true);

        assertThatThrownBy(() -> searcher.search(new float[]{1f}, 15, List.of("acts_L1", "acts_L2")))
                .isInstanceOf(RetrievalFailureException.class);
    }

    @Test
    void repeatedCollectionIsSearchedOnceAndStillCountsAsFailed() {
        searchClient.failing.put("acts_L1", true);

        assertThatThrownBy(() -> searcher.search(new float[]{1f}, 15, List.of("acts_L1", "acts_L1")))
                .isInstanceOf(RetrievalFailureException.class)
                .hasMessageContaining("all 1 collection(s)");
    }

    @Test
    void emptyAnswersAreNotFailures() {
        assertThat(searcher.search(new float[]{1f}, 15, List.of("acts_L1", "acts_L2"))).isEmpty();
    }

    @Test
    void requiresCollections() {
        assertThatThrownBy(() -> searcher.search(new float[]{1f}, 15, List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    private static Hit hit(double score, String collection) {
        return new Hit(score, collection, null);
    }

    private static final class FakeSearchClient implements VectorSearchClient {
        final Map<String, List<Hit>> results = new ConcurrentHashMap<>();
        final Map<String, Boolean> failing = new ConcurrentHashMap<>();
        final Map<String, Long> delayMs = new ConcurrentHashMap<>();
        final Map<String, Integer> limits = new ConcurrentHashMap<>();

        @Override
        public List<Hit> search(String collection, float[] vector, int limit) {
            limits.put(collection, limit);
            if (failing.getOrDefault(collection, false)) {
                throw new IllegalStateException("Qdrant returned status 500 for " + collection);
            }
            long delay = delayMs.getOrDefault(collection, 0L);
            if (delay > 0) {
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return List.of();
                }
            }
            return results.getOrDefault(collection, List.of());
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }
}
