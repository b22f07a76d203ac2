package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.Optional;

/**
 * The first balanced JSON value in the text, tolerating prose before and after it.
 */
public class BalancedBraceExtractor implements ResponseExtractor {

    private final JsonMapper mapper;

    public BalancedBraceExtractor(JsonMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "balanced-brace";
    }

    @Override
    public Optional<JsonNode> extract(String raw) {
        String text = JsonText.stripInvisible(raw);
        int start = JsonText.firstOpening(text);
        while (start >= 0) {
            Optional<JsonNode> found = JsonText.readContainer(mapper, JsonText.balancedFrom(text, start));
            if (found.isPresent()) {
                return found;
            }
            int next = JsonText.firstOpening(text.substring(start + 1));
            start = next < 0 ? -1 : start + 1 + next;
        }
        return Optional.empty();
    }
}
