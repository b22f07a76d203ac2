package com.example.protocolrebuild.document;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Document metadata: the version tuple plus free-form fields ({@code name}, {@code company},
 * {@code changelog}, ...). {@code fields} never contains {@code version}.
 */
public record ProtocolMetadata(ProtocolVersion version, ObjectNode fields) {

    public static final String CHANGELOG = "changelog";
    public static final String NAME = "name";

    public ProtocolMetadata {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(fields, "fields");
    }

    public String name() {
        JsonNode name = fields.get(NAME);
        return name != null && name.isString() && !name.asString().isBlank() ? name.asString() : "protocol";
    }

    public JsonNode changelog() {
        return fields.path(CHANGELOG);
    }

    public ProtocolMetadata withVersion(ProtocolVersion newVersion) {
        return new ProtocolMetadata(newVersion, fields);
    }

    public ProtocolMetadata withFields(ObjectNode newFields) {
        return new ProtocolMetadata(version, newFields);
    }
}
