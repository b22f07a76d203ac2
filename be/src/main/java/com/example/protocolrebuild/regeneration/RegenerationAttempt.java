package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.validation.ValidationError;
import tools.jackson.databind.JsonNode;

/**
 * One oracle call for one section. {@code rawResponse} is {@code null} when the call itself
 * failed; {@code error} is {@code null} when the attempt was accepted.
 */
public record RegenerationAttempt(int attemptNumber, SectionRequest request, String rawResponse, JsonNode parsedResult, ValidationError error) {

    public boolean succeeded() {
        return error == null;
    }
}
