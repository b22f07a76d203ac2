package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.Optional;

/**
 * The whole response is JSON, once byte-order marks and zero-width characters are removed.
 */
public class DirectJsonExtractor implements ResponseExtractor {

    private final JsonMapper mapper;

    public DirectJsonExtractor(JsonMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public Optional<JsonNode> extract(String raw) {
        return JsonText.readContainer(mapper, JsonText.stripInvisible(raw));
    }
}
