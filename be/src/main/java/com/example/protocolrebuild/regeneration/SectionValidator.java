package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.DocumentFormatException;
import com.example.protocolrebuild.document.ExpressionLocator;
import com.example.protocolrebuild.document.ExpressionSite;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolDocumentCodec;
import com.example.protocolrebuild.document.ProtocolMetadata;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.expression.ExpressionCheck;
import com.example.protocolrebuild.expression.ExpressionSafetyValidator;
import com.example.protocolrebuild.expression.IdentifierUniverse;
import com.example.protocolrebuild.partition.Section;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.NodeShapeValidator;
import com.example.protocolrebuild.validation.ValidationError;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a parsed oracle response against the section it answers.
 * <p>
 * Node sections: the response must echo exactly the section's node ids (none missing, none
 * invented, no duplicates), keep each node's kind, and respect the kind-specific field shape.
 * Positions are restored from the original. A section that had no suggestions must come back
 * with the same field names. Every embedded expression is then checked against the identifier
 * universe of the document with this section's nodes swapped in; expressions the sanitizer can
 * fix are rewritten in place.
 * </p>
 * <p>
 * Metadata sections may only change {@code changelog}.
 * </p>
 */
public class SectionValidator {

    private final ProtocolDocumentCodec codec;
    private final ExpressionSafetyValidator expressionValidator;

    public SectionValidator(ProtocolDocumentCodec codec, ExpressionSafetyValidator expressionValidator) {
        this.codec = codec;
        this.expressionValidator = expressionValidator;
    }

    public SectionCheck validate(Section section, ProtocolDocument original, JsonNode response) {
        return section.kind() == SectionKind.METADATA
                ? validateMetadata(section, original, response)
                : validateNodes(section, original, response);
    }

    private SectionCheck validateMetadata(Section section, ProtocolDocument original, JsonNode response) {
        Optional<ObjectNode> metadata = SectionPayloadReader.metadata(response);
        if (metadata.isEmpty()) {
            return SectionCheck.structural(List.of(structural(section.label(), "response contains no metadata object")));
        }
        JsonNode changelog = metadata.get().get(ProtocolMetadata.CHANGELOG);
        if (changelog == null || changelog.isNull()) {
            return SectionCheck.structural(List.of(structural(section.label() + ".metadata", "changelog is missing from the response")));
        }
        ObjectNode fields = original.metadata().fields().deepCopy();
        fields.set(ProtocolMetadata.CHANGELOG, changelog.deepCopy());
        return new SectionCheck(List.of(), fields, List.of(), List.of(), List.of());
    }

    private SectionCheck validateNodes(Section section, ProtocolDocument original, JsonNode response) {
        Optional<ArrayNode> list = SectionPayloadReader.nodeList(response);
        if (list.isEmpty()) {
            return SectionCheck.structural(List.of(structural(section.label(), "response contains no node list")));
        }

        Map<String, ProtocolNode> originals = new LinkedHashMap<>();
        for (String id : section.nodeIds()) {
            original.node(id).ifPresent(n -> originals.put(id, n));
        }

        List<ValidationError> errors = new ArrayList<>();
        Map<String, ProtocolNode> accepted = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode raw : list.get()) {
            String location = section.label() + ".nodes[" + index++ + "]";
            ProtocolNode node;
            try {
                node = codec.nodeFromTree(raw);
            } catch (DocumentFormatException e) {
                errors.add(structural(location, e.getMessage()));
                continue;
            }
            if (!seen.add(node.id())) {
                errors.add(structural(location, "duplicate node id '" + node.id() + "'"));
                continue;
            }
            ProtocolNode before = originals.get(node.id());
            if (before == null) {
                errors.add(structural(location, "node id '" + node.id() + "' is not part of this section; ids must be echoed back unchanged"));
                continue;
            }
            if (node.kind() != before.kind()) {
                errors.add(structural("nodes[" + node.id() + "].kind",
                        "kind changed from " + before.kind().wireName() + " to " + node.kind().wireName()));
            }
            node = node.withPosition(before.position());
            errors.addAll(NodeShapeValidator.check(node, ErrorKind.SECTION_STRUCTURE));
            if (!section.hasSuggestions() && !fieldNames(node).equals(fieldNames(before))) {
                errors.add(structural("nodes[" + node.id() + "].fields",
                        "fields changed on a node with no suggestions: expected " + fieldNames(before) + " but got " + fieldNames(node)));
            }
            accepted.put(node.id(), node);
        }
        for (String id : originals.keySet()) {
            if (!seen.contains(id)) {
                errors.add(structural(section.label(), "node id '" + id + "' is missing from the response; every node must be returned"));
            }
        }
        if (!errors.isEmpty()) {
            return SectionCheck.structural(errors);
        }

        List<ProtocolNode> ordered = new ArrayList<>();
        for (String id : originals.keySet()) {
            ordered.add(accepted.get(id));
        }
        IdentifierUniverse universe = IdentifierUniverse.of(original.replacingNodes(ordered));
        List<ExpressionViolation> violations = new ArrayList<>();
        List<ProtocolNode> checked = new ArrayList<>();
        for (ProtocolNode node : ordered) {
            ObjectNode fields = null;
            for (ExpressionSite site : ExpressionLocator.sites(node)) {
                ExpressionCheck check = expressionValidator.checkOrSanitize(site.expression(), universe, site.location());
                if (!check.valid()) {
                    violations.add(new ExpressionViolation(site, check.error()));
                } else if (check.sanitized()) {
                    if (fields == null) {
                        fields = node.fieldsCopy();
                    }
                    site.path().assign(fields, StringNode.valueOf(check.expression()));
                }
            }
            checked.add(fields == null ? node : node.withFields(fields));
        }
        return new SectionCheck(checked, null, List.of(), violations, List.of());
    }

    /**
     * Puts back the original value of every field with an expression violation (removing it if
     * the field did not exist before) and flags each one. Structural errors cannot be reverted.
     */
    public SectionCheck revertViolations(SectionCheck check, ProtocolDocument original) {
        if (!check.hasOnlyExpressionViolations()) {
            throw new IllegalStateException("only expression violations can be reverted");
        }
        Map<String, ObjectNode> edited = new LinkedHashMap<>();
        List<FieldFlag> flags = new ArrayList<>();
        for (ExpressionViolation violation : check.expressionViolations()) {
            ExpressionSite site = violation.site();
            ProtocolNode current = check.nodes().stream()
                    .filter(n -> n.id().equals(site.nodeId()))
                    .findFirst()
                    .orElseThrow();
            ObjectNode fields = edited.computeIfAbsent(site.nodeId(), id -> current.fieldsCopy());
            JsonNode before = original.node(site.nodeId())
                    .map(n -> site.path().resolve(n.fields()))
                    .orElse(null);
            site.path().assign(fields, before);
            flags.add(new FieldFlag(site.nodeId(), site.path(),
                    violation.error().message() + "; reverted to " + (before == null ? "no value" : "original value")));
        }
        List<ProtocolNode> nodes = new ArrayList<>();
        for (ProtocolNode node : check.nodes()) {
            ObjectNode fields = edited.get(node.id());
            nodes.add(fields == null ? node : node.withFields(fields));
        }
        return new SectionCheck(nodes, check.metadataFields(), List.of(), List.of(), flags);
    }

    private static Set<String> fieldNames(ProtocolNode node) {
        Set<String> names = new HashSet<>();
        for (Map.Entry<String, JsonNode> property : node.fields().properties()) {
            names.add(property.getKey());
        }
        return names;
    }

    private static ValidationError structural(String location, String message) {
        return new ValidationError(ErrorKind.SECTION_STRUCTURE, location, message);
    }
}
