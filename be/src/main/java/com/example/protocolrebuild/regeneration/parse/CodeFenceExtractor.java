package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Optional;

/**
 * JSON inside a markdown fence. The closing fence is not required: the value is cut by bracket
 * balance from the first opening bracket after the marker.
 */
public class CodeFenceExtractor implements ResponseExtractor {

    private static final List<String> MARKERS = List.of("```json", "```JSON", "```");

    private final JsonMapper mapper;

    public CodeFenceExtractor(JsonMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return "code-fence";
    }

    @Override
    public Optional<JsonNode> extract(String raw) {
        String text = JsonText.stripInvisible(raw);
        for (String marker : MARKERS) {
            int at = text.indexOf(marker);
            while (at >= 0) {
                String body = text.substring(at + marker.length());
                Optional<JsonNode> found = JsonText.readContainer(mapper, JsonText.balancedFrom(body, JsonText.firstOpening(body)));
                if (found.isPresent()) {
                    return found;
                }
                at = text.indexOf(marker, at + marker.length());
            }
        }
        return Optional.empty();
    }
}
