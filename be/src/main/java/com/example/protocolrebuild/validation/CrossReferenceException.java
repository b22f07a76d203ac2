package com.example.protocolrebuild.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when the assembled document is not self-consistent (duplicate ids, dangling edges,
 * expressions referencing identifiers that no longer exist).
 * <p>
 * Fatal for the whole run: nothing is persisted. Mapped to HTTP 422 by
 * {@link com.example.protocolrebuild.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class CrossReferenceException extends RuntimeException {

    private final List<ValidationError> errors;

    public CrossReferenceException(List<ValidationError> errors) {
        super("Cross-reference validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
