package com.example.protocolrebuild.pipeline;

import com.example.protocolrebuild.assembly.SectionAssembler;
import com.example.protocolrebuild.audit.AuditReport;
import com.example.protocolrebuild.audit.ChangeVerifier;
import com.example.protocolrebuild.document.DocumentFormatException;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.partition.Section;
import com.example.protocolrebuild.partition.SectionPartitioner;
import com.example.protocolrebuild.regeneration.RegenerationOrchestrator;
import com.example.protocolrebuild.regeneration.SectionOutcome;
import com.example.protocolrebuild.regeneration.SectionStatus;
import com.example.protocolrebuild.suggestion.PreflightResult;
import com.example.protocolrebuild.suggestion.Suggestion;
import com.example.protocolrebuild.suggestion.SuggestionPreflight;
import com.example.protocolrebuild.validation.CrossReferenceValidator;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * One reconstruction run: input checks, partition, per-section regeneration, assembly,
 * cross-reference validation and change verification, in that order.
 * <p>
 * Section failures are contained and reported; a cross-reference failure aborts the run with
 * {@link com.example.protocolrebuild.validation.CrossReferenceException}. A cancelled run stops
 * after regeneration and never assembles a partial document.
 * </p>
 */
@Slf4j
public class ReconstructionPipeline {

    private final CrossReferenceValidator crossReferenceValidator;
    private final SectionPartitioner partitioner;
    private final SuggestionPreflight preflight;
    private final RegenerationOrchestrator orchestrator;
    private final SectionAssembler assembler;
    private final ChangeVerifier changeVerifier;

    public ReconstructionPipeline(CrossReferenceValidator crossReferenceValidator, SectionPartitioner partitioner,
                                  SuggestionPreflight preflight, RegenerationOrchestrator orchestrator,
                                  SectionAssembler assembler, ChangeVerifier changeVerifier) {
        this.crossReferenceValidator = crossReferenceValidator;
        this.partitioner = partitioner;
        this.preflight = preflight;
        this.orchestrator = orchestrator;
        this.assembler = assembler;
        this.changeVerifier = changeVerifier;
    }

    /**
     * @throws DocumentFormatException if the input document is not self-consistent
     * @throws com.example.protocolrebuild.suggestion.InvalidSuggestionException if a suggestion cannot be applied at all
     * @throws com.example.protocolrebuild.validation.CrossReferenceException if the assembled document is not self-consistent
     */
    public ReconstructionResult run(ProtocolDocument document, List<Suggestion> suggestions, ReconstructionOptions options) {
        List<ValidationError> inputErrors = crossReferenceValidator.inspect(document, ErrorKind.INPUT);
        if (!inputErrors.isEmpty()) {
            throw new DocumentFormatException("input document is not self-consistent", inputErrors);
        }
        partitioner.checkTargets(document, suggestions);

        PreflightResult checked = preflight.check(suggestions);
        ProtocolVersion targetVersion = targetVersion(document.version(), options.highestKnownVersion());
        log.info("Starting reconstruction protocol={} from={} to={} suggestions={} withheld={}",
                document.metadata().name(), document.version(), targetVersion, suggestions.size(), checked.rejected().size());

        List<Section> sections = partitioner.partition(document, checked.accepted());
        List<SectionOutcome> outcomes = orchestrator.regenerateAll(sections, document, targetVersion, options.cancellation());

        if (outcomes.stream().anyMatch(o -> o.status() == SectionStatus.CANCELLED)) {
            long done = outcomes.stream().filter(o -> o.status() != SectionStatus.CANCELLED).count();
            log.warn("Reconstruction cancelled protocol={} completedSections={} of={}", document.metadata().name(), done, outcomes.size());
            return new ReconstructionResult(ReconstructionStatus.INCOMPLETE, targetVersion, null, null, outcomes, checked.rejected());
        }

        ProtocolDocument assembled = assembler.assemble(document, outcomes, targetVersion);
        crossReferenceValidator.validate(assembled);
        AuditReport audit = changeVerifier.verify(document, assembled, suggestions, checked.rejected(), outcomes);

        ReconstructionStatus status = audit.hasFailures() ? ReconstructionStatus.COMPLETED_WITH_FAILURES : ReconstructionStatus.COMPLETED;
        log.info("Reconstruction finished protocol={} version={} status={} sections={}",
                document.metadata().name(), targetVersion, status, outcomes.size());
        return new ReconstructionResult(status, targetVersion, assembled, audit, outcomes, checked.rejected());
    }

    /**
     * Next patch after the document's own version, or after the highest stored version if that is later.
     */
    static ProtocolVersion targetVersion(ProtocolVersion current, ProtocolVersion highestKnown) {
        ProtocolVersion base = highestKnown != null && highestKnown.isAfter(current) ? highestKnown : current;
        return base.nextPatch();
    }
}
