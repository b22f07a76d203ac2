package com.example.protocolrebuild.document;

import tools.jackson.databind.JsonNode;

import java.util.regex.Pattern;

/**
 * The {@code [CHANGELOG vX.Y.Z]} note appended to the description of every node a
 * reconstruction modifies.
 */
public final class ChangelogMarker {

    public static final String DESCRIPTION = "description";

    private static final Pattern NOTE = Pattern.compile("\\s*\\[CHANGELOG v[^\\]]*][^\\n]*");

    private ChangelogMarker() {
    }

    public static String marker(ProtocolVersion version) {
        return "[CHANGELOG v" + version + "]";
    }

    /**
     * Whether the node's description carries the marker for {@code version}, optionally
     * mentioning {@code suggestionId} after it.
     */
    public static boolean isPresent(ProtocolNode node, ProtocolVersion version, String suggestionId) {
        String description = JsonFields.text(node.fields(), DESCRIPTION);
        if (description == null) {
            return false;
        }
        int at = description.indexOf(marker(version));
        if (at < 0) {
            return false;
        }
        return suggestionId == null || description.indexOf(suggestionId, at) >= 0;
    }

    public static boolean isPresent(JsonNode fields, ProtocolVersion version) {
        String description = JsonFields.text(fields, DESCRIPTION);
        return description != null && description.contains(marker(version));
    }

    /**
     * Removes every changelog note, each running from its marker to the end of its line.
     */
    public static String strip(String text) {
        if (text == null) {
            return null;
        }
        return NOTE.matcher(text).replaceAll("").strip();
    }
}
