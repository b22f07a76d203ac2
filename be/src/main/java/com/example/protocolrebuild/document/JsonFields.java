package com.example.protocolrebuild.document;

import tools.jackson.databind.JsonNode;

/**
 * Null-tolerant reads from JSON trees.
 */
public final class JsonFields {

    private JsonFields() {
    }

    /**
     * The named property when it is a non-blank string, otherwise {@code null}.
     */
    public static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isString() && !value.asString().isBlank() ? value.asString() : null;
    }
}
