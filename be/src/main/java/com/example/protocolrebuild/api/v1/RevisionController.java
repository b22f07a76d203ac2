package com.example.protocolrebuild.api.v1;

import com.example.protocolrebuild.api.v1.dto.RevisionListResponse;
import com.example.protocolrebuild.api.v1.dto.RevisionResponse;
import com.example.protocolrebuild.service.RevisionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Read-only access to stored revisions under {@code /api/v1/revisions}.
 */
@RestController
@RequestMapping("/api/v1/revisions")
@RequiredArgsConstructor
@Slf4j
public class RevisionController {

    private final RevisionService service;

    @GetMapping
    public ResponseEntity<RevisionListResponse> list(@RequestParam(name = "protocol", required = false) String protocol) {
        log.debug("Listing revisions protocol={}", protocol);
        return ResponseEntity.ok(new RevisionListResponse(service.findAll(protocol)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RevisionResponse> getById(@PathVariable UUID id) {
        log.info("Getting revision id={}", id);
        return ResponseEntity.ok(service.findById(id));
    }
}
