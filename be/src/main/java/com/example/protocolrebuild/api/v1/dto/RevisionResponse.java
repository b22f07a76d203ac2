package com.example.protocolrebuild.api.v1.dto;

import tools.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * A stored revision with its document and rendered audit ledger.
 */
public record RevisionResponse(
        UUID id,
        String protocolName,
        String version,
        String status,
        JsonNode document,
        String audit,
        Instant createdAt
) {}
