package com.advotac.assistant.model;

import org.springframework.lang.Nullable;

/**
 * Display-safe projection of a hit. Passage text is cut to {@link #SNIPPET_LENGTH} characters.
 */
public record SourceView(
        String collection,
        double score,
        Layer layer,
        @Nullable String title,
        @Nullable String sectionNumber,
        @Nullable String heading,
        @Nullable String breadcrumbs,
        @Nullable String unitId,
        @Nullable String snippet) {
    public static final int SNIPPET_LENGTH = 600;

    public static SourceView of(Hit hit, Layer layer) {
        HitMetadata meta = hit.metadata();
        String text = meta.textOrEmpty().trim();
        String snippet = text.isEmpty() ? null : text.substring(0, Math.min(SNIPPET_LENGTH, text.length()));
        return new SourceView(hit.collectionId(), hit.score(), layer, meta.title(), meta.sectionNumber(),
                meta.heading(), meta.breadcrumbs(), meta.unitId(), snippet);
    }
}
