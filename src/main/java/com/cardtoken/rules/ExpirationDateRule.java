package com.cardtoken.rules;

import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.FieldErrorCode;
import com.cardtoken.validation.ValidationErrors;

/**
 * Rule that checks expiration month and year.
 *
 * Expiration is optional. Once either field is set, both are checked on their
 * own, so a lone year of 1980 is reported even though the token has no
 * complete expiration date.
 */
public class ExpirationDateRule implements CardTokenRule {

    static final int EARLIEST_INVALID_YEAR = 1987;

    @Override
    public void evaluate(CardToken cardToken, ValidationErrors errors) {
        int month = CardToken.coerce(cardToken.getMonth());
        int year = CardToken.coerce(cardToken.getYear());

        if (month == 0 && year == 0) {
            return;
        }

        if (!isValidMonth(month)) {
            errors.add(FieldErrorCode.INVALID_EXPIRATION_MONTH);
        }
        if (!isValidExpiryYear(year)) {
            errors.add(FieldErrorCode.INVALID_EXPIRATION_YEAR);
        }
    }

    static boolean isValidMonth(int month) {
        return month >= 1 && month <= 12;
    }

    static boolean isValidExpiryYear(int year) {
        return String.valueOf(year).matches("\\d{4}") && year > EARLIEST_INVALID_YEAR;
    }

    @Override
    public String getRuleName() {
        return "ExpirationDate";
    }
}
