package com.example.protocolrebuild.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the rule grammar:
 * <pre>
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := operand (('==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=' | 'in' | 'not' 'in') operand)?
 * operand    := IDENT | STRING | NUMBER | True | False | '[' literal (',' literal)* ']' | '(' or ')'
 * </pre>
 * Characters are checked against an allow-list before any parsing. Calls, attribute access,
 * subscripts, assignment and reserved words are reported by name so the message can be fed
 * back to whoever wrote the rule. Length and nesting depth are bounded so an oversized
 * rule is a syntax error rather than a stack overflow.
 */
public final class ExpressionParser {

    private static final Set<String> RESERVED = Set.of(
            "import", "from", "lambda", "def", "class", "return", "yield", "await", "async",
            "exec", "eval", "compile", "globals", "locals", "del", "global", "nonlocal",
            "if", "else", "elif", "for", "while", "with", "as", "is", "assert", "raise",
            "try", "except", "finally", "pass", "break", "continue", "None", "null");

    public static final int MAX_LENGTH = 4000;
    public static final int MAX_DEPTH = 64;

    private final String text;
    private int i;
    private int depth;

    private ExpressionParser(String text) {
        this.text = text;
    }

    /**
     * @throws ExpressionSyntaxException at the first violation
     */
    public static Expression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("expression is empty", 0);
        }
        if (expression.length() > MAX_LENGTH) {
            throw new ExpressionSyntaxException("expression is longer than " + MAX_LENGTH + " characters", MAX_LENGTH);
        }
        ExpressionParser parser = new ExpressionParser(expression);
        parser.checkCharacters();
        Expression result = parser.parseOr();
        parser.skipSpaces();
        if (parser.i < expression.length()) {
            throw parser.unexpected();
        }
        return result;
    }

    private void checkCharacters() {
        char quote = 0;
        for (int k = 0; k < text.length(); k++) {
            char c = text.charAt(k);
            if (quote != 0) {
                if (c == '\\') {
                    k++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (!isAllowed(c)) {
                throw new ExpressionSyntaxException("disallowed character '" + c + "' at position " + k, k);
            }
        }
        if (quote != 0) {
            throw new ExpressionSyntaxException("unterminated string literal", text.length());
        }
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                || c == '_' || c == ' ' || c == '\t' || c == '\n' || c == '\r'
                || "()[],.=!<>-".indexOf(c) >= 0;
    }

    private Expression parseOr() {
        List<Expression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (acceptKeyword("or")) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Or(operands);
    }

    private Expression parseAnd() {
        List<Expression> operands = new ArrayList<>();
        operands.add(parseNot());
        while (acceptKeyword("and")) {
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.And(operands);
    }

    private Expression parseNot() {
        if (acceptKeyword("not")) {
            descend();
            Expression negated = new Expression.Not(parseNot());
            depth--;
            return negated;
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseOperand();
        Expression.Operator op = acceptOperator();
        if (op == null) {
            return left;
        }
        Expression right = parseOperand();
        skipSpaces();
        int save = i;
        if (acceptOperator() != null) {
            throw new ExpressionSyntaxException("chained comparison is not allowed", save);
        }
        return new Expression.Comparison(left, op, right);
    }

    private Expression.Operator acceptOperator() {
        skipSpaces();
        if (i >= text.length()) {
            return null;
        }
        if (text.startsWith("==", i)) {
            i += 2;
            return Expression.Operator.EQ;
        }
        if (text.startsWith("!=", i)) {
            i += 2;
            return Expression.Operator.NE;
        }
        if (text.startsWith("<=", i)) {
            i += 2;
            return Expression.Operator.LE;
        }
        if (text.startsWith(">=", i)) {
            i += 2;
            return Expression.Operator.GE;
        }
        char c = text.charAt(i);
        if (c == '<') {
            i++;
            return Expression.Operator.LT;
        }
        if (c == '>') {
            i++;
            return Expression.Operator.GT;
        }
        if (c == '=') {
            throw new ExpressionSyntaxException("disallowed assignment '=' (use '==')", i);
        }
        if (acceptKeyword("in")) {
            return Expression.Operator.IN;
        }
        int save = i;
        if (acceptKeyword("not")) {
            if (acceptKeyword("in")) {
                return Expression.Operator.NOT_IN;
            }
            i = save;
        }
        return null;
    }

    private Expression parseOperand() {
        skipSpaces();
        if (i >= text.length()) {
            throw new ExpressionSyntaxException("unexpected end of expression", i);
        }
        char c = text.charAt(i);
        if (c == '(') {
            i++;
            descend();
            Expression inner = parseOr();
            expect(')');
            depth--;
            return inner;
        }
        if (c == '[') {
            descend();
            Expression list = parseList();
            depth--;
            return list;
        }
        if (c == '\'' || c == '"') {
            return new Expression.StringLiteral(readString());
        }
        if (Character.isDigit(c) || (c == '-' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
            return new Expression.NumberLiteral(readNumber());
        }
        if (isIdentifierStart(c)) {
            int start = i;
            String name = readWord();
            switch (name) {
                case "True", "true" -> {
                    return new Expression.BooleanLiteral(true);
                }
                case "False", "false" -> {
                    return new Expression.BooleanLiteral(false);
                }
                case "and", "or", "not", "in" -> throw new ExpressionSyntaxException("unexpected keyword '" + name + "'", start);
                default -> {
                }
            }
            if (RESERVED.contains(name) || name.startsWith("__")) {
                throw new ExpressionSyntaxException("disallowed keyword '" + name + "'", start);
            }
            rejectPostfix(name);
            return new Expression.Identifier(name);
        }
        throw unexpected();
    }

    private void descend() {
        if (++depth > MAX_DEPTH) {
            throw new ExpressionSyntaxException("expression is nested deeper than " + MAX_DEPTH + " levels", i);
        }
    }

    private void rejectPostfix(String name) {
        int save = i;
        skipSpaces();
        if (i >= text.length()) {
            return;
        }
        char next = text.charAt(i);
        if (next == '(') {
            throw new ExpressionSyntaxException("disallowed call " + name + "(...)", save);
        }
        if (next == '.') {
            i++;
            skipSpaces();
            String member = i < text.length() && isIdentifierStart(text.charAt(i)) ? readWord() : "";
            throw new ExpressionSyntaxException("disallowed attribute access " + name + "." + member, save);
        }
        if (next == '[') {
            throw new ExpressionSyntaxException("disallowed subscript " + name + "[...]", save);
        }
        i = save;
    }

    private Expression parseList() {
        expect('[');
        List<Expression> elements = new ArrayList<>();
        skipSpaces();
        if (peek() == ']') {
            i++;
            return new Expression.ListLiteral(elements);
        }
        while (true) {
            Expression element = parseOperand();
            if (!(element instanceof Expression.StringLiteral
                    || element instanceof Expression.NumberLiteral
                    || element instanceof Expression.BooleanLiteral)) {
                throw new ExpressionSyntaxException("list elements must be literals", i);
            }
            elements.add(element);
            skipSpaces();
            char c = peek();
            if (c == ',') {
                i++;
                skipSpaces();
                if (peek() == ']') {
                    i++;
                    return new Expression.ListLiteral(elements);
                }
            } else if (c == ']') {
                i++;
                return new Expression.ListLiteral(elements);
            } else {
                throw unexpected();
            }
        }
    }

    private String readString() {
        char quote = text.charAt(i++);
        StringBuilder sb = new StringBuilder();
        while (i < text.length()) {
            char c = text.charAt(i++);
            if (c == '\\' && i < text.length()) {
                sb.append(text.charAt(i++));
            } else if (c == quote) {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        throw new ExpressionSyntaxException("unterminated string literal", i);
    }

    private String readNumber() {
        int start = i;
        if (text.charAt(i) == '-') {
            i++;
        }
        while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
        if (i < text.length() && text.charAt(i) == '.') {
            i++;
            int fraction = i;
            while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
            if (fraction == i) {
                throw new ExpressionSyntaxException("malformed number", start);
            }
        }
        if (i < text.length() && isIdentifierStart(text.charAt(i))) {
            throw new ExpressionSyntaxException("malformed number", start);
        }
        return text.substring(start, i);
    }

    private String readWord() {
        int start = i;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
        return text.substring(start, i);
    }

    private boolean acceptKeyword(String keyword) {
        skipSpaces();
        if (!text.startsWith(keyword, i)) {
            return false;
        }
        int end = i + keyword.length();
        if (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
            return false;
        }
        i = end;
        return true;
    }

    private void expect(char c) {
        skipSpaces();
        if (i >= text.length() || text.charAt(i) != c) {
            throw new ExpressionSyntaxException("expected '" + c + "' at position " + i, i);
        }
        i++;
    }

    private char peek() {
        return i < text.length() ? text.charAt(i) : 0;
    }

    private ExpressionSyntaxException unexpected() {
        if (i >= text.length()) {
            return new ExpressionSyntaxException("unexpected end of expression", i);
        }
        return new ExpressionSyntaxException("unexpected '" + text.charAt(i) + "' at position " + i, i);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private void skipSpaces() {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
    }
}
