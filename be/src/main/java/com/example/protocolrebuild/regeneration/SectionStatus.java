package com.example.protocolrebuild.regeneration;

public enum SectionStatus {
    /** Not sent to the oracle; original content kept. */
    UNCHANGED,
    REGENERATED,
    /** Attempts exhausted or a non-retriable oracle error; original content kept. */
    FAILED,
    /** Never reached because the run was cancelled. */
    CANCELLED
}
