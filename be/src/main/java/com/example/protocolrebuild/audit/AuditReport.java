package com.example.protocolrebuild.audit;

import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.regeneration.SectionStatus;

import java.util.List;

/**
 * The human-readable outcome ledger of one reconstruction. Read-only.
 */
public record AuditReport(String protocolName, ProtocolVersion fromVersion, ProtocolVersion toVersion,
                          List<AuditEntry> entries, List<SectionSummary> sections) {

    public AuditReport {
        entries = List.copyOf(entries);
        sections = List.copyOf(sections);
    }

    public long count(AuditOutcome outcome) {
        return entries.stream().filter(e -> !e.isSectionProblem() && e.outcome() == outcome).count();
    }

    /**
     * True when any suggestion failed, any section failed, or any field was reverted.
     */
    public boolean hasFailures() {
        return entries.stream().anyMatch(e -> e.outcome() == AuditOutcome.FAILED)
                || sections.stream().anyMatch(s -> s.status() == SectionStatus.FAILED);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("RECONSTRUCTION AUDIT: ").append(protocolName)
                .append(" v").append(fromVersion).append(" -> v").append(toVersion).append("\n");
        sb.append("Result: ").append(hasFailures()
                ? "COMPLETED WITH FAILURES - manual follow-up required"
                : "COMPLETED").append("\n");
        sb.append("Suggestions: ").append(count(AuditOutcome.APPLIED)).append(" applied, ")
                .append(count(AuditOutcome.SKIPPED)).append(" skipped, ")
                .append(count(AuditOutcome.FAILED)).append(" failed\n");

        sb.append("\nSUGGESTIONS\n");
        for (AuditEntry entry : entries) {
            if (entry.isSectionProblem()) {
                continue;
            }
            sb.append("[").append(entry.outcome()).append("] ").append(entry.suggestionId())
                    .append(" ").append(entry.nodeId()).append(" ").append(entry.targetField()).append("\n");
            sb.append("    before: ").append(entry.before() == null ? "(none)" : entry.before()).append("\n");
            sb.append("    after:  ").append(entry.after() == null ? "(none)" : entry.after()).append("\n");
            if (entry.reason() != null) {
                sb.append("    reason: ").append(entry.reason()).append("\n");
            }
            if (entry.outcome() == AuditOutcome.APPLIED && !"metadata".equals(entry.nodeId())) {
                sb.append("    changelog marker: ").append(entry.changelogMarker() ? "present" : "missing").append("\n");
            }
        }

        sb.append("\nSECTIONS\n");
        for (SectionSummary section : sections) {
            sb.append("section ").append(section.index())
                    .append(section.nodeIds().isEmpty() ? " (metadata)" : " " + section.nodeIds())
                    .append(" ").append(section.status())
                    .append(" attempts=").append(section.attempts())
                    .append(" retries=").append(section.retries()).append("\n");
        }

        List<AuditEntry> problems = entries.stream().filter(AuditEntry::isSectionProblem).toList();
        if (!problems.isEmpty()) {
            sb.append("\nMANUAL FOLLOW-UP\n");
            for (AuditEntry problem : problems) {
                sb.append("- section ").append(problem.sectionIndex());
                if (problem.nodeId() != null) {
                    sb.append(" node ").append(problem.nodeId());
                }
                if (problem.targetField() != null) {
                    sb.append(" field ").append(problem.targetField());
                }
                sb.append(": ").append(problem.reason()).append("\n");
            }
        }
        return sb.toString();
    }
}
