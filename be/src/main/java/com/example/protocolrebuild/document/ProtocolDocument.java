package com.example.protocolrebuild.document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The whole workflow graph: ordered nodes, edges between them, and metadata.
 * <p>
 * Instances are values; "mutations" return a new document. Self-consistency (unique ids,
 * resolvable edges, valid expressions) is checked by
 * {@link com.example.protocolrebuild.validation.CrossReferenceValidator}, not here.
 * </p>
 */
public record ProtocolDocument(List<ProtocolNode> nodes, List<ProtocolEdge> edges, ProtocolMetadata metadata) {
    public ProtocolDocument {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        Objects.requireNonNull(metadata, "metadata");
    }

    public ProtocolVersion version() {
        return metadata.version();
    }

    public Optional<ProtocolNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Set<String> nodeIds() {
        return nodes.stream().map(ProtocolNode::id).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Returns a copy where every node whose id matches one of {@code replacements} is swapped
     * for the replacement. Order and all other nodes are untouched.
     */
    public ProtocolDocument replacingNodes(Collection<ProtocolNode> replacements) {
        Map<String, ProtocolNode> byId = replacements.stream()
                .collect(Collectors.toMap(ProtocolNode::id, Function.identity(), (a, b) -> b));
        List<ProtocolNode> merged = new ArrayList<>(nodes.size());
        for (ProtocolNode node : nodes) {
            merged.add(byId.getOrDefault(node.id(), node));
        }
        return new ProtocolDocument(merged, edges, metadata);
    }

    public ProtocolDocument withNodes(List<ProtocolNode> newNodes) {
        return new ProtocolDocument(newNodes, edges, metadata);
    }

    public ProtocolDocument withMetadata(ProtocolMetadata newMetadata) {
        return new ProtocolDocument(nodes, edges, newMetadata);
    }
}
