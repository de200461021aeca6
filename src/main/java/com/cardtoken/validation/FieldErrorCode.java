package com.cardtoken.validation;

/**
 * Kinds of findings produced when validating a card token.
 */
public enum FieldErrorCode {

    INVALID_TOKEN("token", "is not a valid card token"),
    INVALID_EXPIRATION_MONTH("month", "is not a valid month"),
    INVALID_EXPIRATION_YEAR("year", "is not a valid year"),
    INVALID_BRAND("brand", "is invalid");

    private final String field;
    private final String message;

    FieldErrorCode(String field, String message) {
        this.field = field;
        this.message = message;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }
}
