package com.example.protocolrebuild.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for one stored protocol version produced by a reconstruction run.
 * <p>
 * Stores the serialized document in {@code document_json} and the audit ledger in
 * {@code audit_report}. Written once, never updated.
 * </p>
 */
@Entity
@Table(name = "protocol_revision")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProtocolRevision {

    @Id
    private UUID id;

    @Column(name = "protocol_name", nullable = false, length = 255)
    private String protocolName;

    @Column(nullable = false, length = 32)
    private String version;

    @Column(nullable = false, length = 32)
    private String status;

    @Column(name = "document_json", nullable = false, columnDefinition = "CLOB")
    private String documentJson;

    @Column(name = "audit_report", nullable = false, columnDefinition = "CLOB")
    private String auditReport;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public ProtocolRevision(UUID id, String protocolName, String version, String status,
                            String documentJson, String auditReport, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.protocolName = Objects.requireNonNull(protocolName, "protocolName");
        this.version = Objects.requireNonNull(version, "version");
        this.status = Objects.requireNonNull(status, "status");
        this.documentJson = Objects.requireNonNull(documentJson, "documentJson");
        this.auditReport = Objects.requireNonNull(auditReport, "auditReport");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }
}
