package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.ProtocolNode;
import com.example.protocolrebuild.validation.ValidationError;
import tools.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating one parsed response against its section. Structural errors make the
 * response unusable; expression violations name individual fields that can be reverted.
 */
public record SectionCheck(
        List<ProtocolNode> nodes,
        ObjectNode metadataFields,
        List<ValidationError> structuralErrors,
        List<ExpressionViolation> expressionViolations,
        List<FieldFlag> flags
) {
    private static final int MAX_REPORTED_ERRORS = 20;

    public SectionCheck {
        nodes = List.copyOf(nodes);
        structuralErrors = List.copyOf(structuralErrors);
        expressionViolations = List.copyOf(expressionViolations);
        flags = List.copyOf(flags);
    }

    static SectionCheck structural(List<ValidationError> errors) {
        return new SectionCheck(List.of(), null, errors, List.of(), List.of());
    }

    public boolean isValid() {
        return structuralErrors.isEmpty() && expressionViolations.isEmpty();
    }

    public boolean hasOnlyExpressionViolations() {
        return structuralErrors.isEmpty() && !expressionViolations.isEmpty();
    }

    public List<ValidationError> errors() {
        List<ValidationError> all = new ArrayList<>(structuralErrors);
        expressionViolations.forEach(v -> all.add(v.error()));
        return all;
    }

    /**
     * Every error on its own line, the text fed back to the oracle on retry.
     */
    public String describeErrors() {
        List<ValidationError> all = errors();
        String text = all.stream()
                .limit(MAX_REPORTED_ERRORS)
                .map(ValidationError::describe)
                .collect(Collectors.joining("\n"));
        return all.size() > MAX_REPORTED_ERRORS
                ? text + "\n... and " + (all.size() - MAX_REPORTED_ERRORS) + " more"
                : text;
    }
}
