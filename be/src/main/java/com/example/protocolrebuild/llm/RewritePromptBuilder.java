package com.example.protocolrebuild.llm;

import com.example.protocolrebuild.document.ChangelogMarker;
import com.example.protocolrebuild.partition.SectionKind;
import com.example.protocolrebuild.regeneration.SectionRequest;
import com.example.protocolrebuild.suggestion.Suggestion;

/**
 * Renders a {@link SectionRequest} into the system and user messages sent to the chat model.
 */
public class RewritePromptBuilder {

    private static final String NODE_SYSTEM_PROMPT = """
            You rewrite one section of a clinical workflow document by applying approved change requests.
            You receive the section's nodes as JSON and return the same nodes, changed only where a request says so.

            Rules:
            1. Return EVERY node you received, each with exactly the same "id" and "kind". Do not add, drop, rename or merge nodes.
            2. Keep each node's "fields" object: unknown properties must be returned unchanged.
            3. Apply only the listed requests. Do not rephrase or restructure anything else.
            4. Conditions and expressions use a restricted grammar only:
               - comparisons: ==, !=, <, <=, >, >=
               - membership: 'option_id' in question_uid, 'option_id' not in question_uid
               - combinators: and, or, not, parentheses
               - operands: question uids, derived expression names, quoted strings, numbers, True, False, [lists of literals]
               Never use function calls, attribute access (a.b), indexing, assignment, &&, || or !.
            5. For every node you modify, append to its "description" (after a blank line):
               %s: <summary of the change>
               - Suggestion ID: <id of the request>
            6. Answer with JSON only, in the form {"nodes": [ ... ]}. No prose, no markdown.
            """;

    private static final String METADATA_SYSTEM_PROMPT = """
            You update the changelog of a clinical workflow document.
            You receive the document metadata as JSON and a list of approved change requests for its changelog.
            Return {"metadata": {"changelog": <updated changelog>}} as JSON only, with no prose and no markdown.
            Keep every existing changelog entry; only add what the requests ask for.
            """;

    public String systemPrompt(SectionRequest request) {
        if (request.kind() == SectionKind.METADATA) {
            return METADATA_SYSTEM_PROMPT;
        }
        return NODE_SYSTEM_PROMPT.formatted(ChangelogMarker.marker(request.targetVersion()));
    }

    public String userPrompt(SectionRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Target version: ").append(request.targetVersion()).append("\n");
        if (request.kind() == SectionKind.NODES) {
            sb.append("Node ids you must return: ").append(String.join(", ", request.nodeIds())).append("\n");
        }
        sb.append("\nCURRENT CONTENT:\n").append(request.payload()).append("\n");
        sb.append("\nCHANGE REQUESTS:\n");
        if (request.suggestions().isEmpty()) {
            sb.append("(none: return the content unchanged)\n");
        }
        int n = 1;
        for (Suggestion s : request.suggestions()) {
            sb.append(n++).append(". [").append(s.id()).append("] ")
                    .append(s.modificationType().wireName()).append(" ")
                    .append(s.targetNodeId()).append(" -> ").append(s.targetField()).append("\n");
            if (s.proposedValue() != null) {
                sb.append("   proposed value: ").append(s.proposedValue()).append("\n");
            }
            if (s.rationale() != null && !s.rationale().isBlank()) {
                sb.append("   rationale: ").append(s.rationale()).append("\n");
            }
        }
        if (request.isRetry()) {
            sb.append("\nYOUR PREVIOUS ANSWER WAS REJECTED (attempt ").append(request.attemptNumber() - 1).append("):\n")
                    .append(request.priorError()).append("\n")
                    .append("Fix exactly these problems and answer again with the complete section.\n");
        }
        return sb.toString();
    }
}
