package com.example.protocolrebuild.audit;

import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.regeneration.SectionOutcome;
import com.example.protocolrebuild.regeneration.SectionStatus;

import java.util.List;

public record SectionSummary(int index, SectionKind kind, List<String> nodeIds, SectionStatus status, int attempts, int retries, String error) {

    public static SectionSummary of(SectionOutcome outcome) {
        return new SectionSummary(
                outcome.section().index(),
                outcome.section().kind(),
                outcome.section().nodeIds(),
                outcome.status(),
                outcome.attempts().size(),
                outcome.retries(),
                outcome.error() != null ? outcome.error().describe() : null);
    }
}
