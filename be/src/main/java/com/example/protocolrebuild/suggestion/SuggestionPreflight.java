package com.example.protocolrebuild.suggestion;

import com.example.protocolrebuild.document.FieldPath;
import com.example.protocolrebuild.expression.ExpressionCheck;
import com.example.protocolrebuild.expression.ExpressionSafetyValidator;
import com.example.protocolrebuild.validation.ErrorKind;
import com.example.protocolrebuild.validation.ValidationError;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Grammar check of proposed expressions before anything is sent to the oracle.
 * <p>
 * Applies to additions and modifications whose target is an expression field, or whose
 * proposed value is an object carrying {@code condition}/{@code expression}. Identifiers are not
 * checked here since a rule may name a question another suggestion introduces; that happens
 * after regeneration. A rejected value is sanitized once; if it still fails the suggestion is
 * withheld and reported as failed.
 * </p>
 */
@Slf4j
public class SuggestionPreflight {

    private final ExpressionSafetyValidator validator;

    public SuggestionPreflight(ExpressionSafetyValidator validator) {
        this.validator = validator;
    }

    public PreflightResult check(List<Suggestion> suggestions) {
        List<Suggestion> accepted = new ArrayList<>();
        List<RejectedSuggestion> rejected = new ArrayList<>();
        for (Suggestion suggestion : suggestions) {
            if (suggestion.modificationType() == ModificationType.REMOVE) {
                accepted.add(suggestion);
                continue;
            }
            String location = "suggestions[" + suggestion.id() + "].proposed_value";
            FieldPath path = suggestion.path();
            JsonNode value = suggestion.proposedValue();
            if (path.isExpressionField()) {
                if (value == null || !value.isString()) {
                    rejected.add(new RejectedSuggestion(suggestion,
                            new ValidationError(ErrorKind.INPUT, location, "proposed value for " + path + " must be an expression string")));
                    continue;
                }
                ExpressionCheck check = validator.checkGrammarOrSanitize(value.asString(), location);
                if (check.valid()) {
                    accepted.add(check.sanitized() ? suggestion.withProposedValue(check.expression()) : suggestion);
                } else {
                    reject(rejected, suggestion, check.error());
                }
            } else if (value != null && value.isObject()) {
                checkEmbedded(suggestion, (ObjectNode) value, location, accepted, rejected);
            } else {
                accepted.add(suggestion);
            }
        }
        return new PreflightResult(accepted, rejected);
    }

    private void checkEmbedded(Suggestion suggestion, ObjectNode value, String location,
                               List<Suggestion> accepted, List<RejectedSuggestion> rejected) {
        ObjectNode rewritten = value.deepCopy();
        boolean changed = false;
        for (String field : FieldPath.EXPRESSION_FIELDS) {
            JsonNode expr = value.get(field);
            if (expr == null || !expr.isString() || expr.asString().isBlank()) {
                continue;
            }
            ExpressionCheck check = validator.checkGrammarOrSanitize(expr.asString(), location + "." + field);
            if (!check.valid()) {
                reject(rejected, suggestion, check.error());
                return;
            }
            if (check.sanitized()) {
                rewritten.put(field, check.expression());
                changed = true;
            }
        }
        accepted.add(changed ? suggestion.withProposedValue(rewritten) : suggestion);
    }

    private static void reject(List<RejectedSuggestion> rejected, Suggestion suggestion, ValidationError error) {
        log.warn("Suggestion withheld id={} node={} field={} error={}", suggestion.id(), suggestion.targetNodeId(), suggestion.targetField(), error.message());
        rejected.add(new RejectedSuggestion(suggestion, error));
    }
}
