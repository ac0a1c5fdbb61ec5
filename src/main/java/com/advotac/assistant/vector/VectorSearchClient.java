package com.advotac.assistant.vector;

import com.advotac.assistant.model.Hit;
import java.util.List;

/**
 * Nearest-neighbour search against one named collection.
 */
public interface VectorSearchClient {

    /**
     * @return hits in the order the store ranked them; empty when the collection has no match
     * @throws RuntimeException when the store cannot be reached or rejects the request
     */
    List<Hit> search(String collection, float[] vector, int limit);

    /**
     * @return {@code true} when the store answers its readiness probe
     */
    boolean isAvailable();
}
