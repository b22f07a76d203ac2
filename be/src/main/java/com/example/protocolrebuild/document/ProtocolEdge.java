package com.example.protocolrebuild.document;

import tools.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Directed relationship between two nodes. The raw wire object is kept so edges are carried
 * forward verbatim (handles, labels and ids included).
 */
public record ProtocolEdge(String source, String target, ObjectNode raw) {
    public ProtocolEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(raw, "raw");
    }

    public String id() {
        return raw.has("id") && raw.get("id").isString() ? raw.get("id").asString() : source + "->" + target;
    }
}
