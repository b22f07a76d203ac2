package com.example.protocolrebuild.document;

import com.example.protocolrebuild.validation.ValidationError;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when an input document cannot be read from the wire format or is not self-consistent.
 */
@Getter
public class DocumentFormatException extends RuntimeException {

    private final List<ValidationError> errors;

    public DocumentFormatException(String message) {
        this(message, List.of());
    }

    public DocumentFormatException(String message, List<ValidationError> errors) {
        super(message);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
