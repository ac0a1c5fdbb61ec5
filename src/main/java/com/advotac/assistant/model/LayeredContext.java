package com.advotac.assistant.model;

/**
 * Serialized context split into one text bucket per layer. Empty buckets are empty strings.
 */
public record LayeredContext(String l1, String l2, String l3, int blockCount, int totalChars) {
    public static final LayeredContext EMPTY = new LayeredContext("", "", "", 0, 0);

    public LayeredContext {
        l1 = l1 == null ? "" : l1;
        l2 = l2 == null ? "" : l2;
        l3 = l3 == null ? "" : l3;
    }

    public boolean isEmpty() {
        return this.l1.isEmpty() && this.l2.isEmpty() && this.l3.isEmpty();
    }
}
