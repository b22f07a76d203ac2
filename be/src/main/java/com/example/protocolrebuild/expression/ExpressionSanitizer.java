package com.example.protocolrebuild.expression;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort rewrite of a small catalog of near-miss rules into the grammar:
 * <ul>
 *     <li>C-style operators: {@code &&}, {@code ||}, {@code ===}, {@code !==}, prefix {@code !}</li>
 *     <li>membership pseudo-functions: {@code contains(q, 'x')} becomes {@code 'x' in q}</li>
 *     <li>wrappers around a membership test: {@code any('x' in q)} becomes {@code ('x' in q)}</li>
 *     <li>method-style membership: {@code q.includes('x')} becomes {@code 'x' in q}</li>
 * </ul>
 * Anything else is left alone; the caller re-validates the result exactly once.
 */
public class ExpressionSanitizer {

    private static final String IDENT = "([A-Za-z_][A-Za-z0-9_]*)";
    private static final String LITERAL_BODY = "'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"|-?\\d+(?:\\.\\d+)?";
    private static final String LITERAL = "(" + LITERAL_BODY + ")";

    private static final Pattern MEMBERSHIP_FUNCTION = Pattern.compile(
            "\\b(?:contains|includes|has|selected|is_selected)\\s*\\(\\s*" + IDENT + "\\s*,\\s*" + LITERAL + "\\s*\\)");
    private static final Pattern MEMBERSHIP_WRAPPER = Pattern.compile(
            "\\b(?:any|all|bool|selected)\\s*\\(\\s*((?:" + LITERAL_BODY + ")\\s+(?:not\\s+)?in\\s+[A-Za-z_][A-Za-z0-9_]*)\\s*\\)");
    private static final Pattern MEMBERSHIP_METHOD = Pattern.compile(
            "\\b" + IDENT + "\\.(?:includes|contains)\\s*\\(\\s*" + LITERAL + "\\s*\\)");

    private final List<UnaryOperator<String>> rules = List.of(
            ExpressionSanitizer::rewriteOperators,
            s -> replaceAll(MEMBERSHIP_FUNCTION, s, m -> m.group(2) + " in " + m.group(1)),
            s -> replaceAll(MEMBERSHIP_WRAPPER, s, m -> "(" + m.group(1) + ")"),
            s -> replaceAll(MEMBERSHIP_METHOD, s, m -> m.group(2) + " in " + m.group(1)));

    /**
     * Returns the rewritten expression, or empty if no rule changed anything.
     */
    public Optional<String> sanitize(String expression) {
        if (expression == null || expression.length() > ExpressionParser.MAX_LENGTH) {
            return Optional.empty();
        }
        String current = expression;
        for (UnaryOperator<String> rule : rules) {
            current = rule.apply(current);
        }
        current = current.trim().replaceAll("\\s{2,}", " ");
        return current.equals(expression.trim()) ? Optional.empty() : Optional.of(current);
    }

    /**
     * Operator rewrites are applied outside string literals only.
     */
    private static String rewriteOperators(String expression) {
        StringBuilder out = new StringBuilder(expression.length() + 8);
        int k = 0;
        while (k < expression.length()) {
            char c = expression.charAt(k);
            if (c == '\'' || c == '"') {
                int end = k + 1;
                while (end < expression.length() && expression.charAt(end) != c) {
                    if (expression.charAt(end) == '\\') {
                        end++;
                    }
                    end++;
                }
                end = Math.min(end + 1, expression.length());
                out.append(expression, k, end);
                k = end;
            } else if (expression.startsWith("&&", k)) {
                out.append(" and ");
                k += 2;
            } else if (expression.startsWith("||", k)) {
                out.append(" or ");
                k += 2;
            } else if (expression.startsWith("===", k)) {
                out.append("==");
                k += 3;
            } else if (expression.startsWith("!==", k)) {
                out.append("!=");
                k += 3;
            } else if (expression.startsWith("!=", k)) {
                out.append("!=");
                k += 2;
            } else if (c == '!') {
                out.append(" not ");
                k++;
            } else {
                out.append(c);
                k++;
            }
        }
        return out.toString();
    }

    private static String replaceAll(Pattern pattern, String input, Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
