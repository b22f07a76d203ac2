package com.example.protocolrebuild.document;

import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the document wire format:
 * <pre>
 * {
 *   "metadata": {"version": "1.2.3", ...free-form},
 *   "nodes": [{"id": "...", "kind": "collection|action|derivation", "position": {"x": 0, "y": 0}, "fields": {...}}],
 *   "edges": [{"source": "...", "target": "...", ...}]
 * }
 * </pre>
 * Node fields and edge objects are kept as JSON trees so unknown properties survive a round trip.
 */
public class ProtocolDocumentCodec {

    private final JsonMapper jsonMapper;

    public ProtocolDocumentCodec(JsonMapper jsonMapper) {
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
    }

    public JsonMapper jsonMapper() {
        return jsonMapper;
    }

    /**
     * Parses a serialized document.
     *
     * @throws DocumentFormatException if the text is not JSON or does not follow the wire format
     */
    public ProtocolDocument read(String json) {
        JsonNode root;
        try {
            root = jsonMapper.readTree(json);
        } catch (JacksonException e) {
            throw new DocumentFormatException("document is not valid JSON: " + e.getOriginalMessage());
        }
        return fromTree(root);
    }

    public ProtocolDocument fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DocumentFormatException("document must be a JSON object");
        }
        List<ValidationError> errors = new ArrayList<>();

        JsonNode nodesNode = root.get("nodes");
        List<ProtocolNode> nodes = new ArrayList<>();
        if (nodesNode == null || !nodesNode.isArray()) {
            errors.add(new ValidationError(ErrorKind.INPUT, "nodes", "nodes must be an array"));
        } else {
            int index = 0;
            for (JsonNode n : nodesNode) {
                try {
                    nodes.add(nodeFromTree(n));
                } catch (DocumentFormatException e) {
                    errors.add(new ValidationError(ErrorKind.INPUT, "nodes[" + index + "]", e.getMessage()));
                }
                index++;
            }
        }

        List<ProtocolEdge> edges = new ArrayList<>();
        JsonNode edgesNode = root.get("edges");
        if (edgesNode != null && !edgesNode.isNull()) {
            if (!edgesNode.isArray()) {
                errors.add(new ValidationError(ErrorKind.INPUT, "edges", "edges must be an array"));
            } else {
                int index = 0;
                for (JsonNode e : edgesNode) {
                    String source = text(e, "source");
                    String target = text(e, "target");
                    if (!e.isObject() || source == null || target == null) {
                        errors.add(new ValidationError(ErrorKind.INPUT, "edges[" + index + "]", "edge requires source and target"));
                    } else {
                        edges.add(new ProtocolEdge(source, target, (ObjectNode) e.deepCopy()));
                    }
                    index++;
                }
            }
        }

        ProtocolMetadata metadata = null;
        try {
            metadata = metadataFromTree(root.get("metadata"));
        } catch (DocumentFormatException e) {
            errors.add(new ValidationError(ErrorKind.INPUT, "metadata.version", e.getMessage()));
        }

        if (!errors.isEmpty()) {
            throw new DocumentFormatException("document does not follow the wire format", errors);
        }
        return new ProtocolDocument(nodes, edges, metadata);
    }

    /**
     * Reads one node object.
     *
     * @throws DocumentFormatException if id or kind are missing or unknown
     */
    public ProtocolNode nodeFromTree(JsonNode n) {
        if (n == null || !n.isObject()) {
            throw new DocumentFormatException("node must be an object");
        }
        String id = text(n, "id");
        if (id == null || id.isBlank()) {
            throw new DocumentFormatException("node id is required");
        }
        String kindName = text(n, "kind");
        NodeKind kind = NodeKind.fromWireName(kindName)
                .orElseThrow(() -> new DocumentFormatException("node " + id + " has unknown kind '" + kindName + "'"));
        Position position = Position.ORIGIN;
        JsonNode p = n.get("position");
        if (p != null && p.isObject()) {
            position = new Position(p.path("x").asDouble(0), p.path("y").asDouble(0));
        }
        JsonNode fields = n.get("fields");
        ObjectNode fieldsCopy;
        if (fields == null || fields.isNull()) {
            fieldsCopy = jsonMapper.createObjectNode();
        } else if (fields.isObject()) {
            fieldsCopy = (ObjectNode) fields.deepCopy();
        } else {
            throw new DocumentFormatException("node " + id + " fields must be an object");
        }
        return new ProtocolNode(id, kind, position, fieldsCopy);
    }

    public ProtocolMetadata metadataFromTree(JsonNode m) {
        if (m == null || m.isNull()) {
            return new ProtocolMetadata(ProtocolVersion.INITIAL, jsonMapper.createObjectNode());
        }
        if (!m.isObject()) {
            throw new DocumentFormatException("metadata must be an object");
        }
        ObjectNode fields = (ObjectNode) m.deepCopy();
        JsonNode version = fields.remove("version");
        ProtocolVersion parsed = version == null || version.isNull()
                ? ProtocolVersion.INITIAL
                : ProtocolVersion.parse(version.asString());
        return new ProtocolMetadata(parsed, fields);
    }

    public ObjectNode toTree(ProtocolDocument document) {
        ObjectNode root = jsonMapper.createObjectNode();
        root.set("metadata", metadataToTree(document.metadata()));
        root.set("nodes", nodesToTree(document.nodes()));
        ArrayNode edges = root.putArray("edges");
        for (ProtocolEdge edge : document.edges()) {
            edges.add(edge.raw().deepCopy());
        }
        return root;
    }

    public ObjectNode metadataToTree(ProtocolMetadata metadata) {
        ObjectNode m = jsonMapper.createObjectNode();
        m.put("version", metadata.version().toString());
        for (Map.Entry<String, JsonNode> entry : metadata.fields().properties()) {
            m.set(entry.getKey(), entry.getValue().deepCopy());
        }
        return m;
    }

    public ArrayNode nodesToTree(List<ProtocolNode> nodes) {
        ArrayNode array = jsonMapper.createArrayNode();
        for (ProtocolNode node : nodes) {
            array.add(nodeToTree(node));
        }
        return array;
    }

    public ObjectNode nodeToTree(ProtocolNode node) {
        ObjectNode n = jsonMapper.createObjectNode();
        n.put("id", node.id());
        n.put("kind", node.kind().wireName());
        ObjectNode position = n.putObject("position");
        position.put("x", node.position().x());
        position.put("y", node.position().y());
        n.set("fields", node.fieldsCopy());
        return n;
    }

    public String write(ProtocolDocument document) {
        return jsonMapper.writer().withDefaultPrettyPrinter().writeValueAsString(toTree(document));
    }

    public String compact(JsonNode tree) {
        return jsonMapper.writeValueAsString(tree);
    }

    public int serializedLength(ProtocolDocument document) {
        return compact(toTree(document)).length();
    }

    public int serializedLength(ProtocolNode node) {
        return compact(nodeToTree(node)).length();
    }

    private static String text(JsonNode n, String field) {
        JsonNode value = n.get(field);
        return value != null && value.isString() ? value.asString() : null;
    }
}
