package com.example.protocolrebuild.suggestion;

import com.example.protocolrebuild.document.FieldPath;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.StringNode;

import java.util.Objects;

/**
 * An approved change request against one field of one node. {@code targetNodeId} {@code metadata}
 * addresses the metadata section. {@code proposedValue} is {@code null} for removals.
 */
public record Suggestion(
        String id,
        String targetNodeId,
        String targetField,
        ModificationType modificationType,
        JsonNode proposedValue,
        String rationale,
        String evidenceReference
) {
    public static final String METADATA_TARGET = "metadata";

    public Suggestion {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(targetNodeId, "targetNodeId");
        Objects.requireNonNull(targetField, "targetField");
        Objects.requireNonNull(modificationType, "modificationType");
    }

    /**
     * @throws IllegalArgumentException if {@code targetField} is not a valid field path
     */
    public FieldPath path() {
        return FieldPath.parse(targetField);
    }

    public boolean targetsMetadata() {
        return METADATA_TARGET.equals(targetNodeId);
    }

    public String proposedText() {
        return proposedValue != null && proposedValue.isString() ? proposedValue.asString() : null;
    }

    public Suggestion withProposedValue(String value) {
        return withProposedValue(StringNode.valueOf(value));
    }

    public Suggestion withProposedValue(JsonNode value) {
        return new Suggestion(id, targetNodeId, targetField, modificationType, value, rationale, evidenceReference);
    }
}
