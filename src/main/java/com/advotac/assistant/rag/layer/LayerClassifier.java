package com.advotac.assistant.rag.layer;

import com.advotac.assistant.model.Hit;
import com.advotac.assistant.model.HitMetadata;
import com.advotac.assistant.model.Layer;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Assigns a hit to L1/L2/L3. Resolution order is fixed: the explicit tier field, then a
 * {@code _L1}/{@code _L2}/{@code _L3} collection suffix, then structure (clause marker means L3,
 * section number means L2, anything else L1). Pure function of metadata and collection id.
 */
@Component
public class LayerClassifier {
    private static final Pattern SUB_SECTION_MARKER = Pattern.compile("\\((?:\\d+[A-Za-z]?|[a-z]{1,4}|[ivxlc]+)\\)");

    public Layer classify(Hit hit) {
        return this.classify(hit.metadata(), hit.collectionId());
    }

    public Layer classify(HitMetadata metadata, String collectionId) {
        Optional<Layer> explicit = Layer.parse(metadata.tier());
        if (explicit.isPresent()) {
            return explicit.get();
        }
        Optional<Layer> fromCollection = fromCollectionSuffix(collectionId);
        if (fromCollection.isPresent()) {
            return fromCollection.get();
        }
        if (hasText(metadata.clause()) || hasText(metadata.subSection())
                || SUB_SECTION_MARKER.matcher(metadata.textOrEmpty()).find()) {
            return Layer.L3;
        }
        if (hasText(metadata.sectionNumber())) {
            return Layer.L2;
        }
        return Layer.L1;
    }

    static Optional<Layer> fromCollectionSuffix(String collectionId) {
        if (collectionId == null || collectionId.isBlank()) {
            return Optional.empty();
        }
        int idx = collectionId.lastIndexOf('_');
        return Layer.parse(idx >= 0 ? collectionId.substring(idx + 1) : collectionId);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
