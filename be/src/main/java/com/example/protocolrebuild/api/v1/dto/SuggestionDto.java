package com.example.protocolrebuild.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

import tools.jackson.databind.JsonNode;

/**
 * One approved change request. {@code proposed_value} is omitted for removals.
 */
public record SuggestionDto(
        @NotBlank String id,
        @JsonProperty("target_node_id") @NotBlank String targetNodeId,
        @JsonProperty("target_field") @NotBlank String targetField,
        @JsonProperty("modification_type") @NotBlank String modificationType,
        @JsonProperty("proposed_value") JsonNode proposedValue,
        String rationale,
        @JsonProperty("evidence_reference") String evidenceReference
) {}
