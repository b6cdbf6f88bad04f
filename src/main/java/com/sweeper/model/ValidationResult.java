package com.sweeper.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of validating a fixed layout. On success {@link #getLayout()} holds the
 * parsed matrix; on failure {@link #getFailedRule()} names the first broken rule.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    boolean ok;
    ValidationRule failedRule;
    String message;
    FixedLayout layout;

    public static ValidationResult success(FixedLayout layout) {
        return new ValidationResult(true, null, "Layout is valid", layout);
    }

    public static ValidationResult failure(ValidationRule rule) {
        return new ValidationResult(false, rule, rule.getMessage(), null);
    }
}
