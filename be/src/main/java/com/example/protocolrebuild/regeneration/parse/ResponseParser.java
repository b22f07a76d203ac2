package com.example.protocolrebuild.regeneration.parse;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the extraction strategies in order; the first one that yields a JSON object or array wins.
 */
@Slf4j
public class ResponseParser {

    private final List<ResponseExtractor> extractors;

    public ResponseParser(List<ResponseExtractor> extractors) {
        if (extractors.isEmpty()) {
            throw new IllegalArgumentException("at least one extractor is required");
        }
        this.extractors = List.copyOf(extractors);
    }

    public static ResponseParser defaults(JsonMapper mapper) {
        return new ResponseParser(List.of(
                new DirectJsonExtractor(mapper),
                new CodeFenceExtractor(mapper),
                new BalancedBraceExtractor(mapper),
                new LenientJsonExtractor(),
                new TruncatedJsonRepair()));
    }

    public List<ResponseExtractor> extractors() {
        return extractors;
    }

    /**
     * @throws MalformedOutputException when every strategy fails
     */
    public JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedOutputException("oracle returned an empty response", List.of());
        }
        for (ResponseExtractor extractor : extractors) {
            Optional<JsonNode> result = extractor.extract(raw);
            if (result.isPresent()) {
                log.debug("Extracted response strategy={} length={}", extractor.name(), raw.length());
                return result.get();
            }
        }
        log.debug("No strategy matched response={}", StringUtils.abbreviate(raw, 300));
        throw new MalformedOutputException("could not extract JSON from response", diagnostics(raw));
    }

    private static List<String> diagnostics(String raw) {
        List<String> diagnostics = new ArrayList<>();
        diagnostics.add("length " + raw.length() + " chars");
        int first = raw.indexOf('{');
        int last = raw.lastIndexOf('}');
        diagnostics.add(first < 0 ? "no '{' found" : "first '{' at " + first);
        if (last < 0) {
            diagnostics.add("no '}' found, output appears incomplete");
        } else {
            int opens = StringUtils.countMatches(raw, '{');
            int closes = StringUtils.countMatches(raw, '}');
            if (opens != closes) {
                diagnostics.add("unbalanced braces (" + opens + " open, " + closes + " close)");
            }
        }
        if (!raw.strip().endsWith("}") && !raw.strip().endsWith("]") && !raw.strip().endsWith("```")) {
            diagnostics.add("response does not end with a closing bracket, may be truncated");
        }
        return diagnostics;
    }
}
