package com.advotac.assistant.model;

import com.advotac.assistant.constant.PayloadKeys;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Typed view of a vector-store payload. Named fields cover both indexer schemas;
 * anything else is kept in {@code extras}.
 *
 * @param title act or document title
 * @param sectionNumber normalized section number when present
 * @param heading section heading
 * @param breadcrumbs hierarchy path, e.g. "Part II / Chapter IV"
 * @param unitId indexer unit identifier
 * @param clause clause marker
 * @param subSection sub-section marker
 * @param text passage text
 * @param tier first tier value that names L1/L2/L3, else the first raw tier value as stored
 * @param extras unmapped payload keys
 */
public record HitMetadata(
        @Nullable String title,
        @Nullable String sectionNumber,
        @Nullable String heading,
        @Nullable String breadcrumbs,
        @Nullable String unitId,
        @Nullable String clause,
        @Nullable String subSection,
        @Nullable String text,
        @Nullable String tier,
        Map<String, Object> extras) {

    public HitMetadata {
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public static HitMetadata empty() {
        return new HitMetadata(null, null, null, null, null, null, null, null, null, Map.of());
    }

    public static HitMetadata fromPayload(@Nullable Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return empty();
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : payload.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null && !PayloadKeys.KNOWN.contains(entry.getKey())) {
                extras.put(entry.getKey(), entry.getValue());
            }
        }
        return new HitMetadata(
                first(payload, PayloadKeys.TITLE),
                first(payload, PayloadKeys.SECTION_NUMBER),
                first(payload, PayloadKeys.HEADING),
                first(payload, PayloadKeys.BREADCRUMBS),
                first(payload, List.of(PayloadKeys.UNIT_ID)),
                first(payload, List.of(PayloadKeys.CLAUSE)),
                first(payload, List.of(PayloadKeys.SUB_SECTION)),
                first(payload, PayloadKeys.TEXT),
                tier(payload),
                extras);
    }

    public String textOrEmpty() {
        return this.text == null ? "" : this.text;
    }

    private static String tier(Map<String, ?> payload) {
        for (String key : PayloadKeys.LAYER) {
            Object value = payload.get(key);
            if (Layer.parse(value).isPresent()) {
                return String.valueOf(value).trim();
            }
        }
        return first(payload, PayloadKeys.LAYER);
    }

    private static String first(Map<String, ?> payload, List<String> keys) {
        for (String key : keys) {
            Object value = payload.get(key);
            if (value == null) {
                continue;
            }
            String str = String.valueOf(value).trim();
            if (!str.isEmpty()) {
                return str;
            }
        }
        return null;
    }
}
