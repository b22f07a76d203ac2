package com.example.protocolrebuild.partition;

import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolDocumentCodec;
import com.example.protocolrebuild.document.ProtocolMetadata;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.expression.IdentifierUniverse;
import com.example.protocolrebuild.suggestion.InvalidSuggestionException;
import com.example.protocolrebuild.suggestion.ModificationType;
import com.example.protocolrebuild.suggestion.Suggestion;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a document into the metadata section plus contiguous node sections and assigns each
 * suggestion to the section holding its target node. Pure: the same document, suggestions and
 * size table always yield the same sections.
 */
@Slf4j
public class SectionPartitioner {

    private final ProtocolDocumentCodec codec;
    private final SectionSizeTable sizeTable;
    private final int maxSectionChars;

    public SectionPartitioner(ProtocolDocumentCodec codec, SectionSizeTable sizeTable, int maxSectionChars) {
        this.codec = codec;
        this.sizeTable = sizeTable;
        this.maxSectionChars = maxSectionChars;
    }

    /**
     * @throws InvalidSuggestionException if any suggestion targets an unknown node or is malformed
     */
    public List<Section> partition(ProtocolDocument document, List<Suggestion> suggestions) {
        checkTargets(document, suggestions);

        int documentChars = codec.serializedLength(document);
        int perSection = sizeTable.nodesPerSection(documentChars);

        Map<String, List<Suggestion>> byNode = new LinkedHashMap<>();
        for (Suggestion suggestion : suggestions) {
            byNode.computeIfAbsent(suggestion.targetNodeId(), k -> new ArrayList<>()).add(suggestion);
        }

        List<Section> sections = new ArrayList<>();
        sections.add(new Section(0, SectionKind.METADATA, List.of(),
                byNode.getOrDefault(Suggestion.METADATA_TARGET, List.of()),
                codec.compact(codec.metadataToTree(document.metadata())).length()));

        List<String> currentIds = new ArrayList<>();
        List<Suggestion> currentSuggestions = new ArrayList<>();
        int currentChars = 0;
        for (ProtocolNode node : document.nodes()) {
            int nodeChars = codec.serializedLength(node);
            boolean full = currentIds.size() >= perSection
                    || (!currentIds.isEmpty() && currentChars + nodeChars > maxSectionChars);
            if (full) {
                sections.add(new Section(sections.size(), SectionKind.NODES, currentIds, currentSuggestions, currentChars));
                currentIds = new ArrayList<>();
                currentSuggestions = new ArrayList<>();
                currentChars = 0;
            }
            if (nodeChars > maxSectionChars) {
                log.warn("Node exceeds section budget nodeId={} chars={} maxSectionChars={}", node.id(), nodeChars, maxSectionChars);
            }
            currentIds.add(node.id());
            currentSuggestions.addAll(byNode.getOrDefault(node.id(), List.of()));
            currentChars += nodeChars;
        }
        if (!currentIds.isEmpty()) {
            sections.add(new Section(sections.size(), SectionKind.NODES, currentIds, currentSuggestions, currentChars));
        }

        log.info("Partitioned document documentChars={} nodesPerSection={} sections={} suggestions={}",
                documentChars, perSection, sections.size(), suggestions.size());
        return sections;
    }

    /**
     * Rejects suggestions that could never be applied: duplicate ids, unknown target nodes,
     * malformed field paths, metadata fields other than {@code changelog}, and additions or
     * modifications without a proposed value.
     *
     * @throws InvalidSuggestionException with every problem found
     */
    public void checkTargets(ProtocolDocument document, List<Suggestion> suggestions) {
        Set<String> nodeIds = document.nodeIds();
        Set<String> seen = new HashSet<>();
        List<ValidationError> errors = new ArrayList<>();
        for (Suggestion suggestion : suggestions) {
            String prefix = "suggestions[" + suggestion.id() + "]";
            if (!seen.add(suggestion.id())) {
                errors.add(new ValidationError(ErrorKind.INPUT, prefix + ".id", "duplicate suggestion id"));
            }
            if (suggestion.targetsMetadata()) {
                if (!ProtocolMetadata.CHANGELOG.equals(suggestion.targetField())) {
                    errors.add(new ValidationError(ErrorKind.INPUT, prefix + ".target_field",
                            "metadata suggestions may only target " + ProtocolMetadata.CHANGELOG));
                }
            } else if (!nodeIds.contains(suggestion.targetNodeId())) {
                String hint = IdentifierUniverse.nearest(suggestion.targetNodeId(), nodeIds)
                        .map(n -> " (did you mean '" + n + "'?)")
                        .orElse("");
                errors.add(new ValidationError(ErrorKind.INPUT, prefix + ".target_node_id",
                        "unknown node '" + suggestion.targetNodeId() + "'" + hint));
            }
            try {
                suggestion.path();
            } catch (IllegalArgumentException e) {
                errors.add(new ValidationError(ErrorKind.INPUT, prefix + ".target_field", e.getMessage()));
            }
            if (suggestion.modificationType() != ModificationType.REMOVE
                    && (suggestion.proposedValue() == null || suggestion.proposedValue().isNull())) {
                errors.add(new ValidationError(ErrorKind.INPUT, prefix + ".proposed_value",
                        suggestion.modificationType().wireName() + " requires a proposed value"));
            }
        }
        if (!errors.isEmpty()) {
            log.warn("Rejected suggestion batch errors={}", errors.size());
            throw new InvalidSuggestionException(errors);
        }
    }
}
