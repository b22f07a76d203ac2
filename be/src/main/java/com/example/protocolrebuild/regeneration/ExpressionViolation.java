package com.example.protocolrebuild.regeneration;

import com.example.protocolrebuild.document.ExpressionSite;
import com.example.protocolrebuild.validation.ValidationError;

public record ExpressionViolation(ExpressionSite site, ValidationError error) {
}
