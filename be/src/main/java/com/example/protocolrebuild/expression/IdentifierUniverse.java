package com.example.protocolrebuild.expression;

import com.example.protocolrebuild.document.JsonFields;
import com.example.protocolrebuild.document.NodeKind;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.similarity.LevenshteinDistance;
import tools.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Names an expression may reference: question {@code uid}s and derivation {@code name}s.
 * Questions that declare {@code options} also constrain which string literals may be
 * compared against them.
 */
public final class IdentifierUniverse {

    private final Set<String> identifiers;
    private final Map<String, Set<String>> optionsByIdentifier;

    private IdentifierUniverse(Set<String> identifiers, Map<String, Set<String>> optionsByIdentifier) {
        this.identifiers = Collections.unmodifiableSet(identifiers);
        this.optionsByIdentifier = Collections.unmodifiableMap(optionsByIdentifier);
    }

    public static IdentifierUniverse of(ProtocolDocument document) {
        return of(document.nodes());
    }

    public static IdentifierUniverse of(Collection<ProtocolNode> nodes) {
        Set<String> identifiers = new LinkedHashSet<>();
        Map<String, Set<String>> options = new LinkedHashMap<>();
        for (ProtocolNode node : nodes) {
            if (node.kind() == NodeKind.COLLECTION) {
                for (JsonNode question : node.fields().path("questions")) {
                    String uid = JsonFields.text(question, "uid");
                    if (StringUtils.isBlank(uid)) {
                        continue;
                    }
                    identifiers.add(uid);
                    JsonNode opts = question.get("options");
                    if (opts != null && opts.isArray() && !opts.isEmpty()) {
                        Set<String> ids = options.computeIfAbsent(uid, k -> new LinkedHashSet<>());
                        for (JsonNode option : opts) {
                            String id = JsonFields.text(option, "id");
                            if (StringUtils.isNotBlank(id)) {
                                ids.add(id);
                            }
                        }
                    }
                }
            } else if (node.kind() == NodeKind.DERIVATION) {
                for (JsonNode derived : node.fields().path("expressions")) {
                    String name = JsonFields.text(derived, "name");
                    if (StringUtils.isNotBlank(name)) {
                        identifiers.add(name);
                    }
                }
            }
        }
        return new IdentifierUniverse(identifiers, options);
    }

    public static IdentifierUniverse of(Set<String> identifiers, Map<String, Set<String>> optionsByIdentifier) {
        return new IdentifierUniverse(new LinkedHashSet<>(identifiers), new LinkedHashMap<>(optionsByIdentifier));
    }

    public boolean contains(String identifier) {
        return identifiers.contains(identifier);
    }

    public Set<String> identifiers() {
        return identifiers;
    }

    /**
     * Declared option ids for a question, or empty when the question accepts free values.
     */
    public Optional<Set<String>> options(String identifier) {
        return Optional.ofNullable(optionsByIdentifier.get(identifier));
    }

    public Optional<String> nearestIdentifier(String candidate) {
        return nearest(candidate, identifiers);
    }

    /**
     * Closest entry by edit distance, if it is close enough to be a plausible typo.
     */
    public static Optional<String> nearest(String candidate, Collection<String> pool) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String known : pool) {
            int distance = LevenshteinDistance.getDefaultInstance().apply(candidate, known);
            if (distance < bestDistance) {
                best = known;
                bestDistance = distance;
            }
        }
        int threshold = Math.max(2, candidate.length() / 3);
        return best != null && bestDistance <= threshold ? Optional.of(best) : Optional.empty();
    }
}
