package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.suggestion.Suggestion;

import java.util.List;

/**
 * Everything the oracle sees for one attempt. {@code payload} is the section's current content
 * as JSON; {@code priorError} is the exact failure text of the previous attempt, or {@code null}
 * on the first one.
 */
public record SectionRequest(
        int sectionIndex,
        SectionKind kind,
        List<String> nodeIds,
        String payload,
        List<Suggestion> suggestions,
        ProtocolVersion targetVersion,
        String priorError,
        int attemptNumber
) {
    public SectionRequest {
        nodeIds = List.copyOf(nodeIds);
        suggestions = List.copyOf(suggestions);
    }

    public boolean isRetry() {
        return priorError != null;
    }
}
