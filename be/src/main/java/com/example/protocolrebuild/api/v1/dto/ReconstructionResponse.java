package com.example.protocolrebuild.api.v1.dto;

import com.example.protocolrebuild.audit.AuditEntry;
import com.example.protocolrebuild.audit.SectionSummary;

import tools.jackson.databind.JsonNode;

import java.util.List;
import java.util.UUID;

/**
 * Result of a reconstruction run. {@code revisionId}, {@code document} and {@code audit} are
 * {@code null} when the run did not complete.
 */
public record ReconstructionResponse(
        String status,
        UUID revisionId,
        String version,
        JsonNode document,
        String audit,
        List<AuditEntry> entries,
        List<SectionSummary> sections
) {}
