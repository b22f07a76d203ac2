package com.example.protocolrebuild.expression;

import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Two-stage check of a rule expression, stopping at the first violation:
 * <ol>
 *     <li>grammar: only comparisons and membership tests combined with {@code and}/{@code or}/{@code not};</li>
 *     <li>identifiers: every bare name is a known question uid or derivation name, and string literals
 *     compared against a question with declared options are among those options.</li>
 * </ol>
 * The {@code OrSanitize} variants rewrite a rejected expression with {@link ExpressionSanitizer} and
 * check the result once more.
 */
@Slf4j
public class ExpressionSafetyValidator {

    private final ExpressionSanitizer sanitizer;

    public ExpressionSafetyValidator(ExpressionSanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public ExpressionCheck checkGrammar(String expression, String location) {
        try {
            Expression parsed = ExpressionParser.parse(expression);
            return ExpressionCheck.accepted(expression, parsed.identifiers());
        } catch (ExpressionSyntaxException e) {
            return ExpressionCheck.rejected(expression, violation(location, e.getMessage()));
        }
    }

    public ExpressionCheck check(String expression, IdentifierUniverse universe, String location) {
        Expression parsed;
        try {
            parsed = ExpressionParser.parse(expression);
        } catch (ExpressionSyntaxException e) {
            return ExpressionCheck.rejected(expression, violation(location, e.getMessage()));
        }
        Set<String> identifiers = parsed.identifiers();
        for (String identifier : identifiers) {
            if (!universe.contains(identifier)) {
                String hint = universe.nearestIdentifier(identifier)
                        .map(n -> " (did you mean '" + n + "'?)")
                        .orElse("");
                return ExpressionCheck.rejected(expression, violation(location, "unknown identifier '" + identifier + "'" + hint));
            }
        }
        Optional<String> optionError = checkOptions(parsed, universe);
        if (optionError.isPresent()) {
            return ExpressionCheck.rejected(expression, violation(location, optionError.get()));
        }
        return ExpressionCheck.accepted(expression, identifiers);
    }

    public ExpressionCheck checkGrammarOrSanitize(String expression, String location) {
        ExpressionCheck first = checkGrammar(expression, location);
        return first.valid() ? first : retrySanitized(first, s -> checkGrammar(s, location));
    }

    public ExpressionCheck checkOrSanitize(String expression, IdentifierUniverse universe, String location) {
        ExpressionCheck first = check(expression, universe, location);
        return first.valid() ? first : retrySanitized(first, s -> check(s, universe, location));
    }

    private ExpressionCheck retrySanitized(ExpressionCheck first, Function<String, ExpressionCheck> recheck) {
        Optional<String> rewritten = sanitizer.sanitize(first.expression());
        if (rewritten.isEmpty()) {
            log.warn("Rejected expression location={} error={}", first.error().location(), first.error().message());
            return first;
        }
        ExpressionCheck second = recheck.apply(rewritten.get());
        if (second.valid()) {
            log.info("Sanitized expression location={} from='{}' to='{}'", first.error().location(), first.expression(), second.expression());
            return second.asSanitized();
        }
        log.warn("Rejected expression after sanitizing location={} error={}", first.error().location(), second.error().message());
        return second.asSanitized();
    }

    private static Optional<String> checkOptions(Expression e, IdentifierUniverse universe) {
        if (e instanceof Expression.Comparison c) {
            if (c.operator().isEquality() || c.operator().isMembership()) {
                Optional<String> error = checkLiteralAgainst(c.left(), c.right(), universe);
                return error.isPresent() ? error : checkLiteralAgainst(c.right(), c.left(), universe);
            }
            return Optional.empty();
        }
        List<Expression> children;
        if (e instanceof Expression.Or or) {
            children = or.operands();
        } else if (e instanceof Expression.And and) {
            children = and.operands();
        } else if (e instanceof Expression.Not not) {
            children = List.of(not.operand());
        } else {
            return Optional.empty();
        }
        for (Expression child : children) {
            Optional<String> error = checkOptions(child, universe);
            if (error.isPresent()) {
                return error;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> checkLiteralAgainst(Expression side, Expression other, IdentifierUniverse universe) {
        if (!(side instanceof Expression.Identifier id)) {
            return Optional.empty();
        }
        Optional<Set<String>> options = universe.options(id.name());
        if (options.isEmpty()) {
            return Optional.empty();
        }
        List<Expression> literals = other instanceof Expression.ListLiteral list ? list.elements() : List.of(other);
        for (Expression literal : literals) {
            if (literal instanceof Expression.StringLiteral s && !options.get().contains(s.value())) {
                return Optional.of(unknownOption(s.value(), id.name(), options.get()));
            }
        }
        return Optional.empty();
    }

    private static String unknownOption(String value, String identifier, Collection<String> options) {
        String hint = IdentifierUniverse.nearest(value, options)
                .map(n -> " (did you mean '" + n + "'?)")
                .orElse("");
        return "unknown option '" + value + "' for '" + identifier + "'" + hint;
    }

    private static ValidationError violation(String location, String message) {
        return new ValidationError(ErrorKind.EXPRESSION_SAFETY, location, message);
    }
}
