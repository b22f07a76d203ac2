package com.example.protocolrebuild.service;

import com.example.protocolrebuild.api.v1.dto.ReconstructionRequest;
import com.example.protocolrebuild.api.v1.dto.ReconstructionResponse;
import com.example.protocolrebuild.api.v1.dto.SuggestionDto;
import com.example.protocolrebuild.audit.AuditReport;
import com.example.protocolrebuild.audit.SectionSummary;
import com.example.protocolrebuild.document.DocumentFormatException;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolDocumentCodec;
import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.domain.ProtocolRevision;
import com.example.protocolrebuild.pipeline.ReconstructionOptions;
import com.example.protocolrebuild.pipeline.ReconstructionPipeline;
import com.example.protocolrebuild.pipeline.ReconstructionResult;
import com.example.protocolrebuild.regeneration.CancellationSignal;
import com.example.protocolrebuild.repository.ProtocolRevisionRepository;
import com.example.protocolrebuild.suggestion.InvalidSuggestionException;
import com.example.protocolrebuild.suggestion.ModificationType;
import com.example.protocolrebuild.suggestion.Suggestion;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.databind.JsonNode;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Application service for reconstruction runs.
 * <p>
 * Reads the request into a {@link ProtocolDocument} and {@link Suggestion}s, runs the
 * {@link ReconstructionPipeline} with the highest stored version of the same protocol as the
 * version floor, and stores a {@link ProtocolRevision} through {@link RevisionService} for every
 * run that produced a document.
 * Cancelled runs and runs aborted by validation store nothing.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconstructionService {

    private final ReconstructionPipeline pipeline;
    private final ProtocolDocumentCodec codec;
    private final ProtocolRevisionRepository repository;
    private final RevisionService revisionService;

    public ReconstructionResponse reconstruct(ReconstructionRequest request) {
        return reconstruct(request, CancellationSignal.none());
    }

    public ReconstructionResponse reconstruct(ReconstructionRequest request, CancellationSignal cancellation) {
        ProtocolDocument document = codec.fromTree(request.document());
        List<Suggestion> suggestions = toSuggestions(request.suggestions());
        String protocolName = document.metadata().name();
        ProtocolVersion highest = highestStoredVersion(protocolName).orElse(null);
        log.debug("Reconstructing protocol={} version={} highestStored={} suggestions={}",
                protocolName, document.version(), highest, suggestions.size());

        ReconstructionResult result = pipeline.run(document, suggestions, new ReconstructionOptions(highest, cancellation));

        List<SectionSummary> sections = result.outcomes().stream().map(SectionSummary::of).toList();
        if (!result.isComplete()) {
            return new ReconstructionResponse(result.status().name(), null, result.targetVersion().toString(),
                    null, null, List.of(), sections);
        }

        AuditReport audit = result.audit();
        String rendered = audit.render();
        UUID id = revisionService.store(protocolName, result.targetVersion().toString(), result.status().name(),
                codec.write(result.document()), rendered);
        return new ReconstructionResponse(result.status().name(), id, result.targetVersion().toString(),
                codec.toTree(result.document()), rendered, audit.entries(), sections);
    }

    Optional<ProtocolVersion> highestStoredVersion(String protocolName) {
        return repository.findByProtocolName(protocolName).stream()
                .map(ProtocolRevision::getVersion)
                .map(ProtocolVersion::parse)
                .max(Comparator.naturalOrder());
    }

    /**
     * @throws InvalidSuggestionException if a modification type is unknown
     */
    static List<Suggestion> toSuggestions(List<SuggestionDto> dtos) {
        if (dtos == null) {
            throw new DocumentFormatException("suggestions must be an array");
        }
        List<ValidationError> errors = new ArrayList<>();
        List<Suggestion> suggestions = new ArrayList<>();
        for (int i = 0; i < dtos.size(); i++) {
            SuggestionDto dto = dtos.get(i);
            String location = "suggestions[" + i + "]";
            if (dto == null) {
                errors.add(new ValidationError(ErrorKind.INPUT, location, "suggestion must be an object"));
                continue;
            }
            Optional<ModificationType> type = ModificationType.fromWireName(dto.modificationType());
            if (type.isEmpty()) {
                errors.add(new ValidationError(ErrorKind.INPUT, location + ".modification_type",
                        "unknown modification type '" + dto.modificationType() + "' (expected add, modify or remove)"));
                continue;
            }
            JsonNode proposed = dto.proposedValue();
            if (proposed != null && (proposed.isNull() || proposed.isMissingNode())) {
                proposed = null;
            }
            suggestions.add(new Suggestion(dto.id(), dto.targetNodeId(), dto.targetField(), type.get(), proposed,
                    dto.rationale(), dto.evidenceReference()));
        }
        if (!errors.isEmpty()) {
            throw new InvalidSuggestionException(errors);
        }
        return suggestions;
    }
}
