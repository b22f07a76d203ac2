package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.partition.Section;
import com.example.protocolrebuild.validation.ValidationError;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Terminal state of one section. {@code nodes} holds what the assembler should use: the
 * accepted content when regenerated, otherwise the originals. {@code metadataFields} is only
 * set for an accepted metadata section.
 */
public record SectionOutcome(
        Section section,
        SectionStatus status,
        List<ProtocolNode> nodes,
        ObjectNode metadataFields,
        List<FieldFlag> flags,
        List<RegenerationAttempt> attempts,
        ValidationError error
) {
    public SectionOutcome {
        nodes = List.copyOf(nodes);
        flags = List.copyOf(flags);
        attempts = List.copyOf(attempts);
    }

    public int retries() {
        return Math.max(0, attempts.size() - 1);
    }

    public boolean isRegenerated() {
        return status == SectionStatus.REGENERATED;
    }

    public boolean isFailed() {
        return status == SectionStatus.FAILED;
    }
}
