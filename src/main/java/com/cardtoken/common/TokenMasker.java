package com.cardtoken.common;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Masks card tokens for logs and API responses.
 *
 * Only the trailing digits are kept; for gateway tokens these match the last
 * digits of the underlying card number.
 */
@Component
public class TokenMasker {

    private static final char MASK = '*';

    private final int visibleDigits;

    public TokenMasker(@Value("${card-token.masking.visible-digits:4}") int visibleDigits) {
        if (visibleDigits < 0) {
            throw new IllegalArgumentException("Visible digits cannot be negative");
        }
        this.visibleDigits = visibleDigits;
    }

    public String mask(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        if (token.length() <= visibleDigits) {
            return String.valueOf(MASK).repeat(token.length());
        }
        int hidden = token.length() - visibleDigits;
        return String.valueOf(MASK).repeat(hidden) + token.substring(hidden);
    }
}
