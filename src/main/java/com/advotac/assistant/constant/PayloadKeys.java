package com.advotac.assistant.constant;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Payload keys written by the statute indexers. Two schemas are live in the index:
 * the flat section schema and the layered acts schema; each logical field lists its
 * keys in lookup order.
 */
public final class PayloadKeys {
    public static final List<String> TITLE = List.of("doc_title", "act_title");
    public static final List<String> SECTION_NUMBER = List.of("section_number_norm", "section_number");
    public static final List<String> HEADING = List.of("section_heading", "heading");
    public static final List<String> BREADCRUMBS = List.of("breadcrumbs", "context_path");
    public static final List<String> TEXT = List.of("search_text", "page_content", "content");
    public static final List<String> LAYER = List.of("layer", "level", "chunk_level");
    public static final String UNIT_ID = "unit_id";
    public static final String CLAUSE = "clause";
    public static final String SUB_SECTION = "sub_section";

    public static final Set<String> KNOWN = Stream.of(TITLE, SECTION_NUMBER, HEADING, BREADCRUMBS, TEXT, LAYER,
                    List.of(UNIT_ID, CLAUSE, SUB_SECTION))
            .flatMap(List::stream)
            .collect(Collectors.toUnmodifiableSet());

    private PayloadKeys() {
    }
}
