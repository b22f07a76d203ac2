package com.example.protocolrebuild.document;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of workflow step. Decides which field shapes a node must carry.
 */
public enum NodeKind {
    /** Questionnaire step: {@code questions[]} with options and visibility expressions. */
    COLLECTION("collection"),
    /** Recommendation step: {@code condition} plus {@code effects[]}. */
    ACTION("action"),
    /** Named sub-expressions reused by other nodes: {@code expressions[]}. */
    DERIVATION("derivation");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<NodeKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(k -> k.wireName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
