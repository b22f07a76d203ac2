package com.example.protocolrebuild.expression;

import lombok.Getter;

/**
 * Thrown by {@link ExpressionParser} at the first construct outside the grammar.
 */
@Getter
public class ExpressionSyntaxException extends RuntimeException {

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }
}
