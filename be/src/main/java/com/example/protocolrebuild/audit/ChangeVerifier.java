package com.example.protocolrebuild.audit;

import com.example.protocolrebuild.document.ChangelogMarker;
import com.example.protocolrebuild.document.FieldPath;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolMetadata;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.regeneration.FieldFlag;
import com.example.protocolrebuild.regeneration.SectionOutcome;
import com.example.protocolrebuild.regeneration.SectionStatus;
import com.example.protocolrebuild.suggestion.RejectedSuggestion;
import com.example.protocolrebuild.suggestion.Suggestion;
import org.apache.commons.lang3.StringUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.StringNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides, for each suggestion, whether its target field really changed the way it claimed,
 * by comparing the original and final documents directly. Whatever the oracle says about its
 * own work is ignored. Adds one entry per failed section and per reverted field that no
 * suggestion accounts for.
 */
public class ChangeVerifier {

    private static final int MAX_VALUE_CHARS = 160;

    public AuditReport verify(ProtocolDocument original, ProtocolDocument result, List<Suggestion> suggestions,
                              List<RejectedSuggestion> rejected, List<SectionOutcome> outcomes) {
        Map<String, RejectedSuggestion> rejectedById = new HashMap<>();
        rejected.forEach(r -> rejectedById.put(r.suggestion().id(), r));
        Map<String, SectionOutcome> outcomeBySuggestion = new HashMap<>();
        Map<String, Suggestion> sent = new HashMap<>();
        for (SectionOutcome outcome : outcomes) {
            for (Suggestion s : outcome.section().suggestions()) {
                outcomeBySuggestion.put(s.id(), outcome);
                sent.put(s.id(), s);
            }
        }

        List<AuditEntry> entries = new ArrayList<>();
        Set<FieldFlag> explainedFlags = new HashSet<>();
        for (Suggestion suggestion : suggestions) {
            entries.add(verifyOne(sent.getOrDefault(suggestion.id(), suggestion), original, result,
                    rejectedById.get(suggestion.id()), outcomeBySuggestion.get(suggestion.id()), explainedFlags));
        }

        for (SectionOutcome outcome : outcomes) {
            if (outcome.status() == SectionStatus.FAILED) {
                entries.add(AuditEntry.sectionProblem(outcome.section().index(), null, null,
                        "section kept its original content: " + (outcome.error() != null ? outcome.error().describe() : "no error recorded")));
            }
            for (FieldFlag flag : outcome.flags()) {
                if (!explainedFlags.contains(flag)) {
                    entries.add(AuditEntry.sectionProblem(outcome.section().index(), flag.nodeId(), flag.path().toString(), flag.message()));
                }
            }
        }

        List<SectionSummary> sections = outcomes.stream().map(SectionSummary::of).toList();
        return new AuditReport(original.metadata().name(), original.version(), result.version(), entries, sections);
    }

    private AuditEntry verifyOne(Suggestion suggestion, ProtocolDocument original, ProtocolDocument result,
                                 RejectedSuggestion rejected, SectionOutcome outcome, Set<FieldFlag> explainedFlags) {
        FieldPath path = suggestion.path();
        JsonNode before = valueAt(original, suggestion, path, null);
        JsonNode after = valueAt(result, suggestion, path, outcome);
        Integer sectionIndex = outcome != null ? outcome.section().index() : null;

        if (rejected != null) {
            return entry(suggestion, AuditOutcome.FAILED, before, after, "withheld before regeneration: " + rejected.error().message(), sectionIndex, false);
        }
        if (outcome == null || outcome.status() == SectionStatus.CANCELLED) {
            return entry(suggestion, AuditOutcome.FAILED, before, after, "section was not processed", sectionIndex, false);
        }
        if (outcome.status() == SectionStatus.FAILED) {
            String reason = "section " + outcome.section().index() + " failed after " + outcome.attempts().size()
                    + " attempt(s): " + (outcome.error() != null ? outcome.error().message() : "unknown error");
            return entry(suggestion, AuditOutcome.FAILED, before, after, reason, sectionIndex, false);
        }
        Optional<FieldFlag> flag = outcome.flags().stream()
                .filter(f -> f.nodeId().equals(suggestion.targetNodeId()) && overlaps(f.path(), path))
                .findFirst();
        if (flag.isPresent()) {
            explainedFlags.add(flag.get());
            return entry(suggestion, AuditOutcome.FAILED, before, after, "rejected: " + flag.get().message(), sectionIndex, false);
        }

        boolean marker = !suggestion.targetsMetadata() && result.node(suggestion.targetNodeId())
                .map(n -> ChangelogMarker.isPresent(n, result.version(), suggestion.id()))
                .orElse(false);
        JsonNode beforeContent = withoutNote(before, path);
        JsonNode afterContent = withoutNote(after, path);
        switch (suggestion.modificationType()) {
            case ADD, MODIFY -> {
                if (afterContent == null) {
                    return entry(suggestion, AuditOutcome.SKIPPED, before, after, "field is absent in the result", sectionIndex, marker);
                }
                if (afterContent.equals(beforeContent)) {
                    return entry(suggestion, AuditOutcome.SKIPPED, before, after, "field value is unchanged", sectionIndex, marker);
                }
                return reflects(afterContent, suggestion.proposedValue(), path)
                        ? entry(suggestion, AuditOutcome.APPLIED, before, after, null, sectionIndex, marker)
                        : entry(suggestion, AuditOutcome.SKIPPED, before, after,
                        "field changed but does not carry the proposed value", sectionIndex, marker);
            }
            case REMOVE -> {
                if (beforeContent == null) {
                    return entry(suggestion, AuditOutcome.SKIPPED, null, after, "field did not exist", sectionIndex, marker);
                }
                return afterContent == null
                        ? entry(suggestion, AuditOutcome.APPLIED, before, after, null, sectionIndex, marker)
                        : entry(suggestion, AuditOutcome.SKIPPED, before, after, "field is still present", sectionIndex, marker);
            }
            default -> throw new IllegalStateException("unhandled modification type " + suggestion.modificationType());
        }
    }

    /**
     * For metadata suggestions the value of interest is the changelog the metadata section
     * produced, before the assembler adds its own entry.
     */
    private static JsonNode valueAt(ProtocolDocument document, Suggestion suggestion, FieldPath path, SectionOutcome outcome) {
        if (suggestion.targetsMetadata()) {
            if (outcome == null) {
                return document.metadata().fields().get(ProtocolMetadata.CHANGELOG);
            }
            return outcome.metadataFields() != null ? outcome.metadataFields().get(ProtocolMetadata.CHANGELOG) : null;
        }
        return document.node(suggestion.targetNodeId())
                .map(ProtocolNode::fields)
                .map(path::resolve)
                .orElse(null);
    }

    /**
     * The value with any changelog note removed when the field is a node description; a
     * description that held nothing but the note counts as absent.
     */
    private static JsonNode withoutNote(JsonNode value, FieldPath path) {
        if (value == null || !value.isString() || !ChangelogMarker.DESCRIPTION.equals(path.toString())) {
            return value;
        }
        String text = ChangelogMarker.strip(value.asString());
        return text.isEmpty() ? null : StringNode.valueOf(text);
    }

    /**
     * Whether {@code actual} carries a scalar proposal: expressions must match apart from
     * whitespace, other text must contain the proposed text, and a list counts when one of its
     * elements does. Structured proposals are satisfied by any change.
     */
    private static boolean reflects(JsonNode actual, JsonNode proposed, FieldPath path) {
        if (proposed == null || proposed.isNull() || proposed.isContainer()) {
            return true;
        }
        if (actual.isArray()) {
            for (JsonNode element : actual) {
                if (reflects(element, proposed, path)) {
                    return true;
                }
            }
            return false;
        }
        if (!proposed.isString()) {
            return actual.isValueNode() && actual.asString().equals(proposed.asString());
        }
        if (!actual.isString()) {
            return false;
        }
        if (path.isExpressionField()) {
            return StringUtils.deleteWhitespace(actual.asString()).equals(StringUtils.deleteWhitespace(proposed.asString()));
        }
        return StringUtils.normalizeSpace(actual.asString()).contains(StringUtils.normalizeSpace(proposed.asString()));
    }

    private static boolean overlaps(FieldPath flagged, FieldPath target) {
        String a = flagged.toString();
        String b = target.toString();
        return a.equals(b) || a.startsWith(b + ".") || b.startsWith(a + ".");
    }

    private static AuditEntry entry(Suggestion s, AuditOutcome outcome, JsonNode before, JsonNode after,
                                    String reason, Integer sectionIndex, boolean marker) {
        return new AuditEntry(s.id(), s.targetNodeId(), s.targetField(), outcome, render(before), render(after), reason, sectionIndex, marker);
    }

    private static String render(JsonNode value) {
        if (value == null) {
            return null;
        }
        return StringUtils.abbreviate(value.isString() ? value.asString() : value.toString(), MAX_VALUE_CHARS);
    }
}
