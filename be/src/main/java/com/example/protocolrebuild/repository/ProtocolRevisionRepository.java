package com.example.protocolrebuild.repository;

import com.example.protocolrebuild.domain.ProtocolRevision;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ProtocolRevisionRepository extends JpaRepository<ProtocolRevision, UUID> {

    List<ProtocolRevision> findByProtocolNameOrderByCreatedAtDesc(String protocolName);

    List<ProtocolRevision> findByProtocolName(String protocolName);

    List<ProtocolRevision> findAllByOrderByCreatedAtDesc();
}
