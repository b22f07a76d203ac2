package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.core.json.JsonReadFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.Optional;

/**
 * Slice from the first {@code {} to the last {@code }}, read with single quotes, unquoted
 * property names and trailing commas allowed.
 */
public class LenientJsonExtractor implements ResponseExtractor {

    private final JsonMapper lenient;

    public LenientJsonExtractor() {
        this.lenient = lenientMapper();
    }

    static JsonMapper lenientMapper() {
        return JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_PROPERTY_NAMES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .build();
    }

    @Override
    public String name() {
        return "lenient";
    }

    @Override
    public Optional<JsonNode> extract(String raw) {
        String text = JsonText.stripInvisible(raw);
        int first = text.indexOf('{');
        int last = text.lastIndexOf('}');
        if (first < 0 || last <= first) {
            return Optional.empty();
        }
        return JsonText.readContainer(lenient, text.substring(first, last + 1));
    }
}
