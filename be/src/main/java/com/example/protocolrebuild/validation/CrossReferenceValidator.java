package com.example.protocolrebuild.validation;

import com.example.protocolrebuild.document.ExpressionLocator;
import com.example.protocolrebuild.document.ExpressionSite;
import com.example.protocolrebuild.document.JsonFields;
import com.example.protocolrebuild.document.NodeKind;
import com.example.protocolrebuild.document.ProtocolDocument;
import com.example.protocolrebuild.document.ProtocolEdge;
import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.expression.ExpressionCheck;
import com.example.protocolrebuild.expression.ExpressionSafetyValidator;
import com.example.protocolrebuild.expression.IdentifierUniverse;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-document invariants no single section can see: unique node ids, unique question uids
 * and derivation names, edges that resolve to existing nodes, and every expression valid against
 * the document's own identifier universe. Node field shapes are checked as well.
 */
@Slf4j
public class CrossReferenceValidator {

    private final ExpressionSafetyValidator expressionValidator;

    public CrossReferenceValidator(ExpressionSafetyValidator expressionValidator) {
        this.expressionValidator = expressionValidator;
    }

    /**
     * Returns every violation, tagged with {@code kind}.
     */
    public List<ValidationError> inspect(ProtocolDocument document, ErrorKind kind) {
        List<ValidationError> errors = new ArrayList<>();

        Set<String> nodeIds = new HashSet<>();
        for (ProtocolNode node : document.nodes()) {
            if (!nodeIds.add(node.id())) {
                errors.add(new ValidationError(kind, "nodes[" + node.id() + "].id", "duplicate node id '" + node.id() + "'"));
            }
            errors.addAll(retag(NodeShapeValidator.check(node, kind), kind));
        }

        Map<String, String> identifierOwner = new HashMap<>();
        for (ProtocolNode node : document.nodes()) {
            if (node.kind() == NodeKind.COLLECTION) {
                for (JsonNode question : node.fields().path("questions")) {
                    claim(JsonFields.text(question, "uid"), node.id(), "question uid", identifierOwner, kind, errors);
                }
            } else if (node.kind() == NodeKind.DERIVATION) {
                for (JsonNode derived : node.fields().path("expressions")) {
                    claim(JsonFields.text(derived, "name"), node.id(), "derivation name", identifierOwner, kind, errors);
                }
            }
        }

        int index = 0;
        for (ProtocolEdge edge : document.edges()) {
            String location = "edges[" + index++ + "]";
            if (!nodeIds.contains(edge.source())) {
                errors.add(new ValidationError(kind, location + ".source", "edge source must reference an existing node id: " + edge.source()));
            }
            if (!nodeIds.contains(edge.target())) {
                errors.add(new ValidationError(kind, location + ".target", "edge target must reference an existing node id: " + edge.target()));
            }
        }

        IdentifierUniverse universe = IdentifierUniverse.of(document);
        for (ExpressionSite site : ExpressionLocator.sites(document.nodes())) {
            ExpressionCheck check = expressionValidator.check(site.expression(), universe, site.location());
            if (!check.valid()) {
                errors.add(new ValidationError(kind, check.error().location(), check.error().message()));
            }
        }
        return errors;
    }

    /**
     * @throws CrossReferenceException listing every violation
     */
    public void validate(ProtocolDocument document) {
        List<ValidationError> errors = inspect(document, ErrorKind.CROSS_REFERENCE);
        if (!errors.isEmpty()) {
            log.error("Cross-reference validation failed errors={} first={}", errors.size(), errors.get(0).describe());
            throw new CrossReferenceException(errors);
        }
    }

    private static void claim(String identifier, String nodeId, String what, Map<String, String> owners,
                              ErrorKind kind, List<ValidationError> errors) {
        if (identifier == null) {
            return;
        }
        String previous = owners.putIfAbsent(identifier, nodeId);
        if (previous != null) {
            errors.add(new ValidationError(kind, "nodes[" + nodeId + "]",
                    what + " '" + identifier + "' is already defined in node " + previous));
        }
    }

    private static List<ValidationError> retag(List<ValidationError> errors, ErrorKind kind) {
        return errors.stream().map(e -> new ValidationError(kind, e.location(), e.message())).toList();
    }
}
