package com.example.protocolrebuild.document;

/**
 * One expression embedded in a node: where it lives and its source text.
 */
public record ExpressionSite(String nodeId, FieldPath path, String expression) {

    public String location() {
        return "nodes[" + nodeId + "].fields." + path;
    }
}
