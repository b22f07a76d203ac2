package com.example.protocolrebuild.api.v1.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * Revision list item (id, protocol name, version, status, createdAt).
 */
public record RevisionListItem(
        UUID id,
        String protocolName,
        String version,
        String status,
        Instant createdAt
) {}
