package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.Optional;

/**
 * Character-level helpers shared by the extractors.
 */
final class JsonText {

    private static final String INVISIBLE = "\uFEFF\u200B\u200C\u200D\uFFFE";

    private JsonText() {
    }

    static String stripInvisible(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int k = 0; k < text.length(); k++) {
            char c = text.charAt(k);
            if (INVISIBLE.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString().trim();
    }

    /**
     * Index of the first {@code {} or {@code [}, or -1.
     */
    static int firstOpening(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) {
            return bracket;
        }
        return bracket < 0 ? brace : Math.min(brace, bracket);
    }

    /**
     * The balanced JSON value starting at {@code start}, skipping brackets inside strings, or
     * {@code null} if it never closes.
     */
    static String balancedFrom(String text, int start) {
        if (start < 0 || start >= text.length()) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        for (int k = start; k < text.length(); k++) {
            char c = text.charAt(k);
            if (inString) {
                if (c == '\\') {
                    k++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, k + 1);
                }
            }
        }
        return null;
    }

    /**
     * Parses and keeps only objects and arrays; scalars are not section payloads.
     */
    static Optional<JsonNode> readContainer(JsonMapper mapper, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode tree = mapper.readTree(candidate);
            return tree != null && tree.isContainer() ? Optional.of(tree) : Optional.empty();
        } catch (JacksonException e) {
            return Optional.empty();
        }
    }
}
