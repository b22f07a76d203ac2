package com.example.protocolrebuild.regeneration;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Unwraps the envelopes oracles put around a section: a bare node array, a single node object,
 * or one of {@code {"nodes": [...]}}, {@code {"section": ...}}, {@code {"reconstructed_section": ...}},
 * {@code {"result": ...}}, nested in any order.
 */
public final class SectionPayloadReader {

    private static final List<String> WRAPPERS = List.of("section", "reconstructed_section", "result");
    private static final int MAX_DEPTH = 4;

    private SectionPayloadReader() {
    }

    public static Optional<ArrayNode> nodeList(JsonNode response) {
        return nodeList(response, 0);
    }

    private static Optional<ArrayNode> nodeList(JsonNode node, int depth) {
        if (node == null || depth > MAX_DEPTH) {
            return Optional.empty();
        }
        if (node.isArray()) {
            return Optional.of((ArrayNode) node);
        }
        if (!node.isObject()) {
            return Optional.empty();
        }
        JsonNode nodes = node.get("nodes");
        if (nodes != null && nodes.isArray()) {
            return Optional.of((ArrayNode) nodes);
        }
        for (String wrapper : WRAPPERS) {
            Optional<ArrayNode> inner = nodeList(node.get(wrapper), depth + 1);
            if (inner.isPresent()) {
                return inner;
            }
        }
        if (node.has("id") && node.has("kind")) {
            ArrayNode single = JsonNodeFactory.instance.arrayNode();
            single.add(node);
            return Optional.of(single);
        }
        return Optional.empty();
    }

    /**
     * The metadata object of a metadata-section response: {@code {"metadata": {...}}}, a wrapped
     * form, or an object that itself carries {@code changelog}.
     */
    public static Optional<ObjectNode> metadata(JsonNode response) {
        return metadata(response, 0);
    }

    private static Optional<ObjectNode> metadata(JsonNode node, int depth) {
        if (node == null || !node.isObject() || depth > MAX_DEPTH) {
            return Optional.empty();
        }
        JsonNode meta = node.get("metadata");
        if (meta != null && meta.isObject()) {
            return Optional.of((ObjectNode) meta);
        }
        for (String wrapper : WRAPPERS) {
            Optional<ObjectNode> inner = metadata(node.get(wrapper), depth + 1);
            if (inner.isPresent()) {
                return inner;
            }
        }
        return node.has("changelog") ? Optional.of((ObjectNode) node) : Optional.empty();
    }
}
