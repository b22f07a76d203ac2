package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolDocumentCodec;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.partition.Section;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.regeneration.parse.MalformedOutputException;
import com.example.protocolrebuild.regeneration.parse.ResponseParser;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.util.backoff.BackOffExecution;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives each section to a terminal state.
 * <p>
 * Per attempt the oracle gets only the section's own content and suggestions, plus the exact
 * error text of the previous attempt. Malformed or invalid responses are retried at once, up to
 * {@link RetryPolicy#maxAttempts()}; transient oracle failures wait out an exponential backoff on
 * their own budget. If the last permitted attempt fails only on expressions, those fields are
 * reverted and flagged and the rest of the section is kept. Any other exhaustion leaves the
 * section's original content in place. Sections are processed one after another; a failure in
 * one never touches another.
 * </p>
 */
@Slf4j
public class RegenerationOrchestrator {

    private final RewriteOracle oracle;
    private final ResponseParser parser;
    private final SectionValidator validator;
    private final ProtocolDocumentCodec codec;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final boolean regenerateUnaffected;

    public RegenerationOrchestrator(RewriteOracle oracle, ResponseParser parser, SectionValidator validator,
                                    ProtocolDocumentCodec codec, RetryPolicy retryPolicy, Sleeper sleeper,
                                    boolean regenerateUnaffected) {
        this.oracle = oracle;
        this.parser = parser;
        this.validator = validator;
        this.codec = codec;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.regenerateUnaffected = regenerateUnaffected;
    }

    /**
     * Processes sections in order. Once {@code cancellation} trips, every remaining section is
     * reported {@link SectionStatus#CANCELLED} without an oracle call.
     */
    public List<SectionOutcome> regenerateAll(List<Section> sections, ProtocolDocument original,
                                              ProtocolVersion targetVersion, CancellationSignal cancellation) {
        List<SectionOutcome> outcomes = new ArrayList<>(sections.size());
        for (Section section : sections) {
            if (cancellation.isCancelled()) {
                outcomes.add(terminal(section, original, SectionStatus.CANCELLED, List.of(), null));
                continue;
            }
            outcomes.add(regenerate(section, original, targetVersion, cancellation));
        }
        return outcomes;
    }

    public SectionOutcome regenerate(Section section, ProtocolDocument original, ProtocolVersion targetVersion,
                                     CancellationSignal cancellation) {
        if (!section.hasSuggestions() && (section.kind() == SectionKind.METADATA || !regenerateUnaffected)) {
            log.debug("Skipping section={} reason=no-suggestions", section.index());
            return terminal(section, original, SectionStatus.UNCHANGED, List.of(), null);
        }
        log.info("Regenerating section={} nodes={} suggestions={}", section.index(), section.nodeIds(), section.suggestions().size());

        List<RegenerationAttempt> attempts = new ArrayList<>();
        BackOffExecution backOff = retryPolicy.startBackOff();
        String priorError = null;
        int invalidResponses = 0;
        int call = 0;

        while (true) {
            if (cancellation.isCancelled()) {
                log.info("Section cancelled section={} attempts={}", section.index(), attempts.size());
                return terminal(section, original, SectionStatus.CANCELLED, attempts, null);
            }
            call++;
            SectionRequest request = buildRequest(section, original, targetVersion, priorError, call);

            String raw;
            try {
                raw = oracle.rewrite(request);
            } catch (TransientOracleException e) {
                ValidationError error = new ValidationError(ErrorKind.TRANSIENT_ORACLE, section.label(), e.getMessage());
                attempts.add(new RegenerationAttempt(call, request, null, null, error));
                long wait = backOff.nextBackOff();
                if (wait == BackOffExecution.STOP) {
                    log.warn("Section failed section={} reason=transient-retries-exhausted attempts={}", section.index(), attempts.size());
                    return terminal(section, original, SectionStatus.FAILED, attempts, error);
                }
                log.warn("Transient oracle failure section={} attempt={} backoffMs={} error={}", section.index(), call, wait, e.getMessage());
                if (!pause(wait, cancellation)) {
                    return terminal(section, original, SectionStatus.CANCELLED, attempts, null);
                }
                continue;
            } catch (OracleException e) {
                ValidationError error = new ValidationError(ErrorKind.ORACLE, section.label(), e.getMessage());
                attempts.add(new RegenerationAttempt(call, request, null, null, error));
                log.warn("Section failed section={} reason=oracle-error error={}", section.index(), e.getMessage());
                return terminal(section, original, SectionStatus.FAILED, attempts, error);
            }
            log.debug("Oracle response section={} attempt={} length={} preview={}", section.index(), call,
                    raw == null ? 0 : raw.length(), StringUtils.abbreviate(raw, 200));

            JsonNode parsed;
            try {
                parsed = parser.parse(raw);
            } catch (MalformedOutputException e) {
                invalidResponses++;
                ValidationError error = new ValidationError(ErrorKind.MALFORMED_OUTPUT, section.label(), e.getMessage());
                attempts.add(new RegenerationAttempt(call, request, raw, null, error));
                if (invalidResponses >= retryPolicy.maxAttempts()) {
                    log.warn("Section failed section={} reason=malformed-output attempts={}", section.index(), attempts.size());
                    return terminal(section, original, SectionStatus.FAILED, attempts, error);
                }
                log.warn("Malformed oracle output section={} attempt={} error={}", section.index(), call, e.getMessage());
                priorError = error.describe() + "\nResponse started with: " + StringUtils.abbreviate(raw, 500);
                continue;
            }

            SectionCheck check = validator.validate(section, original, parsed);
            if (check.isValid()) {
                attempts.add(new RegenerationAttempt(call, request, raw, parsed, null));
                return accepted(section, check, attempts);
            }

            invalidResponses++;
            ValidationError first = check.errors().get(0);
            attempts.add(new RegenerationAttempt(call, request, raw, parsed, first));
            if (invalidResponses >= retryPolicy.maxAttempts()) {
                if (check.hasOnlyExpressionViolations()) {
                    SectionCheck reverted = validator.revertViolations(check, original);
                    log.warn("Section accepted with reverted fields section={} flagged={}", section.index(), reverted.flags().size());
                    return accepted(section, reverted, attempts);
                }
                log.warn("Section failed section={} reason=invalid-response attempts={} error={}", section.index(), attempts.size(), first.describe());
                return terminal(section, original, SectionStatus.FAILED, attempts, first);
            }
            log.warn("Invalid section response section={} attempt={} errors={}", section.index(), call, check.errors().size());
            priorError = check.describeErrors();
        }
    }

    private SectionRequest buildRequest(Section section, ProtocolDocument original, ProtocolVersion targetVersion,
                                        String priorError, int attempt) {
        String payload;
        if (section.kind() == SectionKind.METADATA) {
            payload = codec.compact(codec.metadataToTree(original.metadata().withVersion(targetVersion)));
        } else {
            payload = codec.compact(codec.nodesToTree(originalNodes(section, original)));
        }
        return new SectionRequest(section.index(), section.kind(), section.nodeIds(), payload,
                section.suggestions(), targetVersion, priorError, attempt);
    }

    private boolean pause(long millis, CancellationSignal cancellation) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            log.warn("Interrupted during backoff, cancelling run");
            return false;
        }
    }

    private static SectionOutcome accepted(Section section, SectionCheck check, List<RegenerationAttempt> attempts) {
        log.info("Section done section={} status={} attempts={}", section.index(), SectionStatus.REGENERATED, attempts.size());
        return new SectionOutcome(section, SectionStatus.REGENERATED, check.nodes(), check.metadataFields(),
                check.flags(), attempts, null);
    }

    private static SectionOutcome terminal(Section section, ProtocolDocument original, SectionStatus status,
                                           List<RegenerationAttempt> attempts, ValidationError error) {
        return new SectionOutcome(section, status, originalNodes(section, original), null, List.of(), attempts, error);
    }

    private static List<ProtocolNode> originalNodes(Section section, ProtocolDocument original) {
        List<ProtocolNode> nodes = new ArrayList<>();
        for (String id : section.nodeIds()) {
            original.node(id).ifPresent(nodes::add);
        }
        return nodes;
    }
}
