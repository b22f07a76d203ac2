package com.example.protocolrebuild.document;

import tools.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One workflow step. {@code id} is stable and never reassigned; {@code fields} holds the
 * kind-specific payload (questions, condition and effects, named expressions) plus any
 * additional properties the document carries.
 * <p>
 * Treat {@code fields} as read-only: copy with {@link #fieldsCopy()} before changing it.
 * </p>
 */
public record ProtocolNode(String id, NodeKind kind, Position position, ObjectNode fields) {
    public ProtocolNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(fields, "fields");
    }

    public ObjectNode fieldsCopy() {
        return fields.deepCopy();
    }

    public ProtocolNode withFields(ObjectNode newFields) {
        return new ProtocolNode(id, kind, position, newFields);
    }

    public ProtocolNode withPosition(Position newPosition) {
        return new ProtocolNode(id, kind, newPosition, fields);
    }
}
