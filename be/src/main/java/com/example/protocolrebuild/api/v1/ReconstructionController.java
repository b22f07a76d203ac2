package com.example.protocolrebuild.api.v1;

import com.example.protocolrebuild.api.v1.dto.ReconstructionRequest;
import com.example.protocolrebuild.api.v1.dto.ReconstructionResponse;
import com.example.protocolrebuild.service.ReconstructionService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/v1/reconstructions runs one reconstruction synchronously and returns the new
 * version, the rebuilt document and the audit ledger.
 */
@RestController
@RequestMapping("/api/v1/reconstructions")
@RequiredArgsConstructor
@Slf4j
public class ReconstructionController {

    private final ReconstructionService service;

    @PostMapping
    public ResponseEntity<ReconstructionResponse> reconstruct(@Valid @RequestBody ReconstructionRequest request) {
        log.info("Reconstruction requested suggestions={}", request.suggestions().size());
        ReconstructionResponse response = service.reconstruct(request);
        log.info("Reconstruction done status={} version={} revisionId={}", response.status(), response.version(), response.revisionId());
        return ResponseEntity.ok(response);
    }
}
