package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.FieldPath;

/**
 * A field whose regenerated value was rejected and reverted to its original value.
 */
public record FieldFlag(String nodeId, FieldPath path, String message) {
}
