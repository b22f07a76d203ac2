package com.example.protocolrebuild.document;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Address of a value inside a node's {@code fields}.
 * <p>
 * Dot-separated names; list elements are addressed by key in brackets and matched against
 * the element's {@code uid}, {@code id} or {@code name}: {@code questions[q_age].expression},
 * {@code effects[e1].condition}, {@code description}.
 * </p>
 */
public final class FieldPath {

    /** Field names whose string values are expressions in the restricted grammar. */
    public static final Set<String> EXPRESSION_FIELDS = Set.of("condition", "expression");

    private static final List<String> ELEMENT_KEYS = List.of("uid", "id", "name");
    private static final Pattern SEGMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)(?:\\[([^\\[\\]]+)])?$");

    private final List<Segment> segments;

    private FieldPath(List<Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    /**
     * @throws IllegalArgumentException if the path is blank or a segment is malformed
     */
    public static FieldPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("field path is required");
        }
        List<Segment> segments = new ArrayList<>();
        for (String raw : path.trim().split("\\.", -1)) {
            Matcher m = SEGMENT.matcher(raw.trim());
            if (!m.matches()) {
                throw new IllegalArgumentException("malformed field path segment '" + raw + "' in " + path);
            }
            segments.add(new Segment(m.group(1), m.group(2) != null ? m.group(2).trim() : null));
        }
        return new FieldPath(segments);
    }

    public static FieldPath of(String name) {
        return parse(name);
    }

    /**
     * {@code list[key].field}, built without re-parsing so keys may contain any character but brackets.
     */
    public static FieldPath elementField(String list, String key, String field) {
        return new FieldPath(List.of(new Segment(list, key), new Segment(field, null)));
    }

    public String leafName() {
        return segments.get(segments.size() - 1).name();
    }

    public boolean isExpressionField() {
        Segment leaf = segments.get(segments.size() - 1);
        return leaf.key() == null && EXPRESSION_FIELDS.contains(leaf.name());
    }

    /**
     * Returns the addressed value, or {@code null} when any step is absent.
     */
    public JsonNode resolve(JsonNode fields) {
        JsonNode current = fields;
        for (Segment segment : segments) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment.name());
            if (segment.key() != null) {
                current = findElement(current, segment.key());
            }
        }
        return current == null || current.isNull() || current.isMissingNode() ? null : current;
    }

    /**
     * Sets the addressed value in place, or removes it when {@code value} is {@code null}.
     * Missing intermediate objects are created; a missing keyed element is appended.
     *
     * @return {@code false} if the path cannot be reached (e.g. an intermediate value is not an object)
     */
    public boolean assign(ObjectNode fields, JsonNode value) {
        ObjectNode container = fields;
        for (int i = 0; i < segments.size() - 1; i++) {
            Segment segment = segments.get(i);
            JsonNode next = container.get(segment.name());
            if (segment.key() != null) {
                next = findElement(next, segment.key());
            } else if (next == null && value != null) {
                next = container.putObject(segment.name());
            }
            if (next == null || !next.isObject()) {
                return value == null;
            }
            container = (ObjectNode) next;
        }
        Segment leaf = segments.get(segments.size() - 1);
        if (leaf.key() == null) {
            if (value == null) {
                container.remove(leaf.name());
            } else {
                container.set(leaf.name(), value.deepCopy());
            }
            return true;
        }
        JsonNode list = container.get(leaf.name());
        if (list == null && value != null) {
            list = container.putArray(leaf.name());
        }
        if (list == null || !list.isArray()) {
            return value == null;
        }
        ArrayNode array = (ArrayNode) list;
        int index = indexOf(array, leaf.key());
        if (value == null) {
            if (index >= 0) {
                array.remove(index);
            }
        } else if (index >= 0) {
            array.set(index, value.deepCopy());
        } else {
            array.add(value.deepCopy());
        }
        return true;
    }

    private static JsonNode findElement(JsonNode list, String key) {
        if (list == null || !list.isArray()) {
            return null;
        }
        int index = indexOf(list, key);
        return index >= 0 ? list.get(index) : null;
    }

    private static int indexOf(JsonNode list, String key) {
        for (int i = 0; i < list.size(); i++) {
            JsonNode element = list.get(i);
            if (key.equals(elementKey(element))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Key of a list element: its {@code uid}, {@code id} or {@code name}, first present wins.
     */
    public static String elementKey(JsonNode element) {
        if (element == null || !element.isObject()) {
            return null;
        }
        for (String key : ELEMENT_KEYS) {
            JsonNode value = element.get(key);
            if (value != null && value.isString() && !value.asString().isBlank()) {
                return value.asString();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment.name());
            if (segment.key() != null) {
                sb.append('[').append(segment.key()).append(']');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    private record Segment(String name, String key) {
    }
}
