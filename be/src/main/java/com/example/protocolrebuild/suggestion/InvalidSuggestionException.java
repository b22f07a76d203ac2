package com.example.protocolrebuild.suggestion;

import com.example.protocolrebuild.validation.ValidationError;
import lombok.Getter;

import java.util.List;

/**
 * Suggestions that cannot be applied at all (unknown target node, malformed field path).
 * Raised before any oracle call.
 */
@Getter
public class InvalidSuggestionException extends RuntimeException {

    private final List<ValidationError> errors;

    public InvalidSuggestionException(List<ValidationError> errors) {
        super("Invalid suggestions: " + errors.size() + " error(s)");
        this.errors = List.copyOf(errors);
    }
}
