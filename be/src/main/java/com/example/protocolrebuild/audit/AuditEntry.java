package com.example.protocolrebuild.audit;

/**
 * One line of the ledger: either the outcome of one suggestion, or an unresolved section-level
 * problem ({@code suggestionId} is {@code null} for those).
 */
public record AuditEntry(
        String suggestionId,
        String nodeId,
        String targetField,
        AuditOutcome outcome,
        String before,
        String after,
        String reason,
        Integer sectionIndex,
        boolean changelogMarker
) {
    public static AuditEntry sectionProblem(int sectionIndex, String nodeId, String targetField, String reason) {
        return new AuditEntry(null, nodeId, targetField, AuditOutcome.FAILED, null, null, reason, sectionIndex, false);
    }

    public boolean isSectionProblem() {
        return suggestionId == null;
    }
}
