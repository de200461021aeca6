package com.cardtoken.rules;

import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.FieldErrorCode;
import com.cardtoken.validation.ValidationErrors;

import java.util.regex.Pattern;

/**
 * Rule that checks the token looks like a gateway-issued card token.
 *
 * Tokens keep the length of the original card number and only use numeric
 * characters. The last four digits match the card number, the rest are random,
 * so there is no checksum to verify.
 */
public class TokenFormatRule implements CardTokenRule {

    static final int MIN_TOKEN_LENGTH = 12;

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    @Override
    public void evaluate(CardToken cardToken, ValidationErrors errors) {
        String token = cardToken.getToken() == null ? "" : cardToken.getToken();

        if (token.length() < MIN_TOKEN_LENGTH || !DIGITS.matcher(token).matches()) {
            errors.add(FieldErrorCode.INVALID_TOKEN);
        }
    }

    @Override
    public String getRuleName() {
        return "TokenFormat";
    }
}
