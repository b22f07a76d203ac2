package com.example.protocolrebuild.audit;

public enum AuditOutcome {
    APPLIED, SKIPPED, FAILED
}
