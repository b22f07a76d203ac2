package com.example.protocolrebuild.pipeline;

public enum ReconstructionStatus {
    /** Every section reached a terminal state and nothing failed. */
    COMPLETED,
    /** A document was produced, but some suggestions or sections failed and need follow-up. */
    COMPLETED_WITH_FAILURES,
    /** Cancelled before every section finished; no document was assembled. */
    INCOMPLETE
}
