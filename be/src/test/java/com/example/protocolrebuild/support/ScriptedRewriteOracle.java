package com.example.protocolrebuild.support;

import com.example.protocolrebuild.document.ChangelogMarker;
import com.example.protocolrebuild.document.FieldPath;
import com.example.protocolrebuild.document.ProtocolMetadata;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.regeneration.RewriteOracle;
import com.example.protocolrebuild.regeneration.SectionRequest;
import com.example.protocolrebuild.suggestion.ModificationType;
import com.example.protocolrebuild.suggestion.Suggestion;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Test double for {@link RewriteOracle}. Per section index, scripted replies are served first;
 * once a section's script is used up the oracle answers faithfully: it applies the requested
 * changes to the payload, appends the changelog marker to each touched node's description and
 * wraps the result in {@code {"nodes": [...]}} (or {@code {"metadata": {...}}}).
 */
public class ScriptedRewriteOracle implements RewriteOracle {

    private final Map<Integer, Deque<Function<SectionRequest, String>>> scripts = new HashMap<>();
    private final List<SectionRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public ScriptedRewriteOracle reply(int sectionIndex, String... replies) {
        for (String reply : replies) {
            then(sectionIndex, request -> reply);
        }
        return this;
    }

    public ScriptedRewriteOracle then(int sectionIndex, Function<SectionRequest, String> step) {
        scripts.computeIfAbsent(sectionIndex, k -> new ArrayDeque<>()).add(step);
        return this;
    }

    public ScriptedRewriteOracle fail(int sectionIndex, RuntimeException error, int times) {
        for (int k = 0; k < times; k++) {
            then(sectionIndex, request -> {
                throw error;
            });
        }
        return this;
    }

    public List<SectionRequest> requests() {
        return List.copyOf(requests);
    }

    public List<SectionRequest> requestsFor(int sectionIndex) {
        return requests().stream().filter(r -> r.sectionIndex() == sectionIndex).toList();
    }

    public void reset() {
        scripts.clear();
        requests.clear();
    }

    @Override
    public String rewrite(SectionRequest request) {
        requests.add(request);
        Deque<Function<SectionRequest, String>> script = scripts.get(request.sectionIndex());
        if (script != null && !script.isEmpty()) {
            return script.poll().apply(request);
        }
        return faithful(request);
    }

    public static String faithful(SectionRequest request) {
        JsonNode payload = Protocols.MAPPER.readTree(request.payload());
        ObjectNode envelope = Protocols.MAPPER.createObjectNode();
        if (request.kind() == SectionKind.METADATA) {
            ObjectNode metadata = (ObjectNode) payload;
            for (Suggestion s : request.suggestions()) {
                if (ProtocolMetadata.CHANGELOG.equals(s.targetField()) && s.proposedValue() != null) {
                    metadata.set(ProtocolMetadata.CHANGELOG, s.proposedValue().deepCopy());
                }
            }
            envelope.set("metadata", metadata);
            return Protocols.MAPPER.writeValueAsString(envelope);
        }
        ArrayNode nodes = (ArrayNode) payload;
        for (Suggestion s : request.suggestions()) {
            for (JsonNode node : nodes) {
                if (!s.targetNodeId().equals(node.get("id").asString())) {
                    continue;
                }
                ObjectNode fields = (ObjectNode) node.get("fields");
                FieldPath.parse(s.targetField()).assign(fields, s.modificationType() == ModificationType.REMOVE ? null : s.proposedValue());
                if (!ChangelogMarker.DESCRIPTION.equals(s.targetField()) || s.modificationType() != ModificationType.REMOVE) {
                    JsonNode description = fields.get(ChangelogMarker.DESCRIPTION);
                    String text = description != null && description.isString() ? description.asString() : "";
                    fields.put(ChangelogMarker.DESCRIPTION,
                            (text + " " + ChangelogMarker.marker(request.targetVersion()) + " " + s.id()).trim());
                }
            }
        }
        envelope.set("nodes", nodes);
        return Protocols.MAPPER.writeValueAsString(envelope);
    }
}
