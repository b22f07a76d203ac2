package com.example.protocolrebuild.document;

import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Finds every expression embedded in node fields: top-level {@code condition}/{@code expression}
 * and the same names inside keyed list elements ({@code questions[].expression},
 * {@code effects[].condition}, {@code expressions[].expression}).
 */
public final class ExpressionLocator {

    private ExpressionLocator() {
    }

    public static List<ExpressionSite> sites(Collection<ProtocolNode> nodes) {
        List<ExpressionSite> sites = new ArrayList<>();
        for (ProtocolNode node : nodes) {
            sites.addAll(sites(node));
        }
        return sites;
    }

    public static List<ExpressionSite> sites(ProtocolNode node) {
        List<ExpressionSite> sites = new ArrayList<>();
        for (Map.Entry<String, JsonNode> field : node.fields().properties()) {
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (FieldPath.EXPRESSION_FIELDS.contains(name) && value.isString()) {
                addIfPresent(sites, node.id(), FieldPath.of(name), value.asString());
            } else if (value.isArray()) {
                for (JsonNode element : value) {
                    String key = FieldPath.elementKey(element);
                    if (key == null) {
                        continue;
                    }
                    for (String expressionField : FieldPath.EXPRESSION_FIELDS) {
                        JsonNode expr = element.get(expressionField);
                        if (expr != null && expr.isString()) {
                            addIfPresent(sites, node.id(), FieldPath.elementField(name, key, expressionField), expr.asString());
                        }
                    }
                }
            }
        }
        return sites;
    }

    private static void addIfPresent(List<ExpressionSite> sites, String nodeId, FieldPath path, String expression) {
        if (expression != null && !expression.isBlank()) {
            sites.add(new ExpressionSite(nodeId, path, expression));
        }
    }
}
