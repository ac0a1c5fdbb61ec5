package com.advotac.assistant.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Hierarchy tier of a retrieved passage.
 */
public enum Layer {
    /** Part or chapter heading. */
    L1,
    /** Section-level provision. */
    L2,
    /** Clause or sub-clause detail. */
    L3;

    public static Optional<Layer> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = String.valueOf(raw).trim().toUpperCase(Locale.ROOT);
        for (Layer layer : values()) {
            if (layer.name().equals(value)) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }
}
