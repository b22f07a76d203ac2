package com.example.protocolrebuild.expression;

import com.example.protocolrebuild.validation.ValidationError;

import java.util.Set;

/**
 * Result of checking one expression. When {@code sanitized} is true, {@code expression} is the
 * rewritten text that passed, not the text that was submitted.
 */
public record ExpressionCheck(String expression, boolean valid, ValidationError error, Set<String> identifiers, boolean sanitized) {

    public ExpressionCheck {
        identifiers = identifiers == null ? Set.of() : Set.copyOf(identifiers);
    }

    static ExpressionCheck accepted(String expression, Set<String> identifiers) {
        return new ExpressionCheck(expression, true, null, identifiers, false);
    }

    static ExpressionCheck rejected(String expression, ValidationError error) {
        return new ExpressionCheck(expression, false, error, Set.of(), false);
    }

    ExpressionCheck asSanitized() {
        return new ExpressionCheck(expression, valid, error, identifiers, true);
    }
}
