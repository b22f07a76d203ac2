package com.example.protocolrebuild.regeneration.parse;

import lombok.Getter;

import java.util.List;

/**
 * No extraction strategy produced structured data from an oracle response.
 */
@Getter
public class MalformedOutputException extends RuntimeException {

    private final List<String> diagnostics;

    public MalformedOutputException(String message, List<String> diagnostics) {
        super(message + (diagnostics.isEmpty() ? "" : "; " + String.join("; ", diagnostics)));
        this.diagnostics = List.copyOf(diagnostics);
    }
}
