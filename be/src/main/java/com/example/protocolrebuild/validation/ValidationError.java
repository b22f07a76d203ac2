package com.example.protocolrebuild.validation;

import java.util.Objects;

/**
 * A single validation error: what kind of check failed, where, and why.
 * <p>
 * {@code location} is a human-readable path such as {@code nodes[node-3].fields.condition}
 * or {@code section[2]}.
 * </p>
 */
public record ValidationError(ErrorKind kind, String location, String message) {
    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Single-line rendering used in logs, retry context and the audit ledger.
     */
    public String describe() {
        return "[" + kind + "] " + location + ": " + message;
    }
}
