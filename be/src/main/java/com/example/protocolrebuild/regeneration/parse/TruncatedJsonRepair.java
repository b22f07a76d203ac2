package com.example.protocolrebuild.regeneration.parse;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Last resort for output cut off at the token budget: closes an open string, drops a trailing
 * comma or dangling property name, then closes every open bracket in reverse order.
 */
public class TruncatedJsonRepair implements ResponseExtractor {

    private final JsonMapper lenient = LenientJsonExtractor.lenientMapper();

    @Override
    public String name() {
        return "truncation-repair";
    }

    @Override
    public Optional<JsonNode> extract(String raw) {
        String text = JsonText.stripInvisible(raw);
        int start = JsonText.firstOpening(text);
        if (start < 0) {
            return Optional.empty();
        }
        return JsonText.readContainer(lenient, repair(text.substring(start)));
    }

    static String repair(String text) {
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        int lastStringStart = -1;
        for (int k = 0; k < text.length(); k++) {
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
                lastStringStart = k;
            } else if (c == '{') {
                open.push('}');
            } else if (c == '[') {
                open.push(']');
            } else if ((c == '}' || c == ']') && !open.isEmpty()) {
                open.pop();
            }
        }
        StringBuilder sb = new StringBuilder(text);
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '\\') {
            sb.setLength(sb.length() - 1);
        }
        if (inString) {
            sb.append('"');
        }
        trimTail(sb);
        if (!open.isEmpty() && open.peek() == '}' && endsWithKey(sb, lastStringStart)) {
            sb.setLength(lastStringStart);
            trimTail(sb);
        }
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == ':') {
            sb.append("null");
        }
        while (!open.isEmpty()) {
            sb.append(open.pop());
        }
        return sb.toString();
    }

    /**
     * A string ending the text directly after {@code {} or {@code ,} of an object is a property
     * name whose value never arrived.
     */
    private static boolean endsWithKey(StringBuilder sb, int stringStart) {
        if (stringStart < 0 || stringStart >= sb.length() - 1 || sb.charAt(sb.length() - 1) != '"') {
            return false;
        }
        int k = stringStart - 1;
        while (k >= 0 && Character.isWhitespace(sb.charAt(k))) {
            k--;
        }
        return k >= 0 && (sb.charAt(k) == '{' || sb.charAt(k) == ',');
    }

    private static void trimTail(StringBuilder sb) {
        while (sb.length() > 0) {
            char last = sb.charAt(sb.length() - 1);
            if (Character.isWhitespace(last) || last == ',') {
                sb.setLength(sb.length() - 1);
            } else {
                return;
            }
        }
    }
}
