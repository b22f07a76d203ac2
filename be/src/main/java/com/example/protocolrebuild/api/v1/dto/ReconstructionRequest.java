package com.example.protocolrebuild.api.v1.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import tools.jackson.databind.JsonNode;

import java.util.List;

/**
 * Request body for a reconstruction run: the current document in wire format plus approved suggestions.
 */
public record ReconstructionRequest(
        @NotNull JsonNode document,
        @NotNull @Valid List<SuggestionDto> suggestions
) {}
