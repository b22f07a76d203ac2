package com.example.protocolrebuild.validation;

import com.example.protocolrebuild.document.JsonFields;
import com.example.protocolrebuild.document.ProtocolNode;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Kind-specific shape of node fields. Unknown properties are allowed and preserved.
 */
public final class NodeShapeValidator {

    public static final Set<String> QUESTION_TYPES = Set.of("select", "multiselect", "text", "number", "date", "boolean");
    private static final Set<String> OPTION_TYPES = Set.of("select", "multiselect");

    private NodeShapeValidator() {
    }

    public static List<ValidationError> check(ProtocolNode node, ErrorKind kind) {
        List<ValidationError> errors = new ArrayList<>();
        String prefix = "nodes[" + node.id() + "].fields";
        JsonNode fields = node.fields();

        requireStringIfPresent(fields, "description", prefix, kind, errors);
        requireStringIfPresent(fields, "condition", prefix, kind, errors);

        switch (node.kind()) {
            case COLLECTION -> checkQuestions(fields.get("questions"), prefix + ".questions", kind, errors);
            case ACTION -> checkKeyedList(fields.get("effects"), "id", false, prefix + ".effects", kind, errors);
            case DERIVATION -> {
                JsonNode expressions = fields.get("expressions");
                if (expressions == null || !expressions.isArray()) {
                    errors.add(new ValidationError(kind, prefix + ".expressions", "derivation node requires an expressions array"));
                } else {
                    checkKeyedList(expressions, "name", true, prefix + ".expressions", kind, errors);
                }
            }
        }
        return errors;
    }

    private static void checkQuestions(JsonNode questions, String location, ErrorKind kind, List<ValidationError> errors) {
        if (questions == null || questions.isNull()) {
            return;
        }
        if (!questions.isArray()) {
            errors.add(new ValidationError(kind, location, "questions must be an array"));
            return;
        }
        Set<String> uids = new HashSet<>();
        int index = 0;
        for (JsonNode question : questions) {
            String uid = JsonFields.text(question, "uid");
            String at = location + "[" + (uid != null ? uid : index) + "]";
            if (uid == null) {
                errors.add(new ValidationError(kind, at + ".uid", "question uid is required"));
            } else if (!uids.add(uid)) {
                errors.add(new ValidationError(kind, at + ".uid", "duplicate question uid '" + uid + "'"));
            }
            String type = JsonFields.text(question, "type");
            if (type != null && !QUESTION_TYPES.contains(type)) {
                errors.add(new ValidationError(kind, at + ".type", "invalid type '" + type + "'; must be one of: " + QUESTION_TYPES));
            }
            JsonNode options = question.get("options");
            if (type != null && OPTION_TYPES.contains(type) && (options == null || !options.isArray() || options.isEmpty())) {
                errors.add(new ValidationError(kind, at + ".options", type + " question requires options"));
            }
            if (options != null && options.isArray()) {
                checkKeyedList(options, "id", false, at + ".options", kind, errors);
            }
            requireStringIfPresent(question, "expression", at, kind, errors);
            index++;
        }
    }

    private static void checkKeyedList(JsonNode list, String keyField, boolean requireExpression,
                                       String location, ErrorKind kind, List<ValidationError> errors) {
        if (list == null || list.isNull()) {
            return;
        }
        if (!list.isArray()) {
            errors.add(new ValidationError(kind, location, "must be an array"));
            return;
        }
        Set<String> keys = new HashSet<>();
        int index = 0;
        for (JsonNode element : list) {
            String key = JsonFields.text(element, keyField);
            String at = location + "[" + (key != null ? key : index) + "]";
            if (key == null) {
                errors.add(new ValidationError(kind, at + "." + keyField, keyField + " is required"));
            } else if (!keys.add(key)) {
                errors.add(new ValidationError(kind, at + "." + keyField, "duplicate " + keyField + " '" + key + "'"));
            }
            if (requireExpression && JsonFields.text(element, "expression") == null) {
                errors.add(new ValidationError(kind, at + ".expression", "expression is required"));
            }
            requireStringIfPresent(element, "condition", at, kind, errors);
            index++;
        }
    }

    private static void requireStringIfPresent(JsonNode object, String field, String location, ErrorKind kind, List<ValidationError> errors) {
        JsonNode value = object.get(field);
        if (value != null && !value.isNull() && !value.isString()) {
            errors.add(new ValidationError(kind, location + "." + field, field + " must be a string"));
        }
    }
}
