package com.example.protocolrebuild.suggestion;

import com.example.protocolrebuild.validation.ValidationError;

public record RejectedSuggestion(Suggestion suggestion, ValidationError error) {
}
