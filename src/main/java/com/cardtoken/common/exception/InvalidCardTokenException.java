package com.cardtoken.common.exception;

import com.cardtoken.validation.ValidationErrors;

/**
 * Thrown when a caller requires a card token to be valid and validation reported findings.
 */
public class InvalidCardTokenException extends CardTokenException {

    private final transient ValidationErrors errors;

    public InvalidCardTokenException(String maskedToken, ValidationErrors errors) {
        super(String.format("Card token %s is invalid: %s", maskedToken, errors));
        this.errors = errors;
    }

    public ValidationErrors getErrors() {
        return errors;
    }
}
