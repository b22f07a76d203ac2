package com.example.protocolrebuild.service;

import com.example.protocolrebuild.api.RevisionNotFoundException;
import com.example.protocolrebuild.api.v1.dto.RevisionListItem;
import com.example.protocolrebuild.api.v1.dto.RevisionResponse;
import com.example.protocolrebuild.domain.ProtocolRevision;
import com.example.protocolrebuild.repository.ProtocolRevisionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Stores protocol revisions and reads them back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevisionService {

    private final ProtocolRevisionRepository repository;
    private final JsonMapper jsonMapper;

    /**
     * Writes one revision in its own transaction, so no connection is held while the pipeline
     * waits on the oracle.
     */
    @Transactional
    public UUID store(String protocolName, String version, String status, String documentJson, String auditReport) {
        ProtocolRevision revision = repository.save(new ProtocolRevision(
                UUID.randomUUID(),
                protocolName,
                version,
                status,
                documentJson,
                auditReport,
                Instant.now()
        ));
        log.info("Stored revision id={} protocol={} version={} status={}", revision.getId(), protocolName, version, status);
        return revision.getId();
    }

    /**
     * Newest first; all protocols when {@code protocolName} is blank.
     */
    @Transactional(readOnly = true)
    public List<RevisionListItem> findAll(String protocolName) {
        List<ProtocolRevision> revisions = protocolName == null || protocolName.isBlank()
                ? repository.findAllByOrderByCreatedAtDesc()
                : repository.findByProtocolNameOrderByCreatedAtDesc(protocolName);
        log.debug("findAll protocol={} returned {} revisions", protocolName, revisions.size());
        return revisions.stream().map(this::toListItem).toList();
    }

    @Transactional(readOnly = true)
    public RevisionResponse findById(UUID id) {
        log.debug("Finding revision by id={}", id);
        ProtocolRevision revision = repository.findById(id)
                .orElseThrow(() -> new RevisionNotFoundException(id));
        return new RevisionResponse(
                revision.getId(),
                revision.getProtocolName(),
                revision.getVersion(),
                revision.getStatus(),
                readDocument(revision.getDocumentJson()),
                revision.getAuditReport(),
                revision.getCreatedAt()
        );
    }

    private RevisionListItem toListItem(ProtocolRevision revision) {
        return new RevisionListItem(revision.getId(), revision.getProtocolName(), revision.getVersion(),
                revision.getStatus(), revision.getCreatedAt());
    }

    private JsonNode readDocument(String documentJson) {
        try {
            return jsonMapper.readTree(documentJson);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize stored document", e);
        }
    }
}
