package com.cardtoken.validation;

import lombok.Value;

/**
 * A single validation finding scoped to a field.
 *
 * {@code code} is null for findings added with a free-form message.
 */
@Value
public class FieldError {
    String field;
    String message;
    FieldErrorCode code;

    public static FieldError of(FieldErrorCode code) {
        return new FieldError(code.getField(), code.getMessage(), code);
    }

    public static FieldError of(String field, String message) {
        return new FieldError(field, message, null);
    }

    /**
     * Message prefixed with the humanized field name, e.g. "Month is not a valid month".
     */
    public String getFullMessage() {
        return humanize(field) + " " + message;
    }

    private static String humanize(String field) {
        String words = field.replace('_', ' ');
        if (words.isEmpty()) {
            return words;
        }
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }
}
