package com.sweeper.exception;

import com.sweeper.model.ValidationResult;
import com.sweeper.model.ValidationRule;
import lombok.Getter;

/**
 * Raised at the session boundary when a caller asks to start a game from a
 * layout that the validator rejected. The validator itself never throws.
 */
@Getter
public class ValidationFailedException extends RuntimeException {

    private final ValidationRule rule;

    public ValidationFailedException(ValidationResult result) {
        super(result.getMessage());
        this.rule = result.getFailedRule();
    }
}
