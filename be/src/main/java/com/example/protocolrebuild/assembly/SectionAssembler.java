package com.example.protocolrebuild.assembly;

import com.example.protocolrebuild.document.Position;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolMetadata;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.document.ProtocolVersion;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.regeneration.SectionOutcome;
import com.example.protocolrebuild.suggestion.Suggestion;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges section outcomes back into one document.
 * <p>
 * Each node comes from its section's outcome: the regenerated node when the section was accepted,
 * the untouched original otherwise. Nodes are stable-sorted by layout position, edges are carried
 * over verbatim, the version is set to the target and a changelog entry is appended to the metadata.
 * </p>
 */
@Slf4j
public class SectionAssembler {

    private static final Comparator<ProtocolNode> LAYOUT = Comparator.comparing(ProtocolNode::position, Position.LAYOUT_ORDER);

    public ProtocolDocument assemble(ProtocolDocument original, List<SectionOutcome> outcomes, ProtocolVersion targetVersion) {
        if (!targetVersion.isAfter(original.version())) {
            throw new IllegalArgumentException("target version " + targetVersion + " must be after " + original.version());
        }
        Map<String, ProtocolNode> chosen = new HashMap<>();
        ObjectNode metadataFields = null;
        for (SectionOutcome outcome : outcomes) {
            if (outcome.section().kind() == SectionKind.METADATA) {
                if (outcome.isRegenerated() && outcome.metadataFields() != null) {
                    metadataFields = outcome.metadataFields().deepCopy();
                }
                continue;
            }
            for (ProtocolNode node : outcome.nodes()) {
                chosen.put(node.id(), node);
            }
        }

        List<ProtocolNode> merged = new ArrayList<>(original.nodes().size());
        for (ProtocolNode node : original.nodes()) {
            merged.add(chosen.getOrDefault(node.id(), node));
        }
        merged.sort(LAYOUT);
        if (merged.size() != original.nodes().size()) {
            throw new IllegalStateException("node count changed during assembly: " + original.nodes().size() + " -> " + merged.size());
        }

        if (metadataFields == null) {
            metadataFields = original.metadata().fields().deepCopy();
        }
        appendChangelogEntry(metadataFields, outcomes, targetVersion);
        ProtocolMetadata metadata = new ProtocolMetadata(targetVersion, metadataFields);

        log.info("Assembled document version={} nodes={} edges={} regeneratedSections={} failedSections={}",
                targetVersion, merged.size(), original.edges().size(),
                outcomes.stream().filter(SectionOutcome::isRegenerated).count(),
                outcomes.stream().filter(SectionOutcome::isFailed).count());
        return new ProtocolDocument(merged, original.edges(), metadata);
    }

    /**
     * Appends {@code {version, suggestions, sections_needing_review}} to an array changelog, or a
     * single line to a text changelog.
     */
    private static void appendChangelogEntry(ObjectNode metadataFields, List<SectionOutcome> outcomes, ProtocolVersion version) {
        List<String> submitted = outcomes.stream()
                .filter(SectionOutcome::isRegenerated)
                .flatMap(o -> o.section().suggestions().stream())
                .map(Suggestion::id)
                .toList();
        List<Integer> review = outcomes.stream()
                .filter(o -> o.isFailed() || !o.flags().isEmpty())
                .map(o -> o.section().index())
                .toList();

        JsonNode existing = metadataFields.get(ProtocolMetadata.CHANGELOG);
        if (existing != null && existing.isString()) {
            String line = "v" + version + ": suggestions " + (submitted.isEmpty() ? "none" : String.join(", ", submitted))
                    + (review.isEmpty() ? "" : "; sections needing review " + review.stream().map(String::valueOf).collect(Collectors.joining(", ")));
            String text = existing.asString();
            metadataFields.set(ProtocolMetadata.CHANGELOG, StringNode.valueOf(text.isBlank() ? line : text + "\n" + line));
            return;
        }
        ArrayNode changelog = existing != null && existing.isArray()
                ? (ArrayNode) existing
                : metadataFields.putArray(ProtocolMetadata.CHANGELOG);
        if (existing != null && !existing.isArray()) {
            changelog.add(existing.deepCopy());
        }
        ObjectNode entry = changelog.addObject();
        entry.put("version", version.toString());
        ArrayNode ids = entry.putArray("suggestions");
        submitted.forEach(ids::add);
        ArrayNode sections = entry.putArray("sections_needing_review");
        review.forEach(i -> sections.add(i.intValue()));
    }
}
