package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One way of pulling structured data out of raw oracle text. Implementations never throw on
 * bad input; they return empty and let the next strategy try.
 */
public interface ResponseExtractor {

    String name();

    Optional<JsonNode> extract(String raw);
}
