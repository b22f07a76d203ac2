package com.example.protocolrebuild.pipeline;

import com.example.protocolrebuild.audit.AuditReport;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.regeneration.SectionOutcome;
import com.example.protocolrebuild.suggestion.RejectedSuggestion;

import java.util.List;

/**
 * {@code document} and {@code audit} are {@code null} when the run is {@link ReconstructionStatus#INCOMPLETE}.
 */
public record ReconstructionResult(
        ReconstructionStatus status,
        ProtocolVersion targetVersion,
        ProtocolDocument document,
        AuditReport audit,
        List<SectionOutcome> outcomes,
        List<RejectedSuggestion> rejected
) {
    public ReconstructionResult {
        outcomes = List.copyOf(outcomes);
        rejected = List.copyOf(rejected);
    }

    public boolean isComplete() {
        return status != ReconstructionStatus.INCOMPLETE;
    }
}
