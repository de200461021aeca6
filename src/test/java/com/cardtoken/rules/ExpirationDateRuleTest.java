package com.cardtoken.rules;

import com.cardtoken.cards.CardToken;
import com.cardtoken.validation.FieldErrorCode;
import com.cardtoken.validation.ValidationErrors;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpirationDateRuleTest {

    private final ExpirationDateRule rule = new ExpirationDateRule();

    @Test
    void testNoExpiration_NoFindings() {
        ValidationErrors errors = evaluate(null, null);
        assertTrue(errors.isEmpty());

        errors = evaluate(0, 0);
        assertTrue(errors.isEmpty());
    }

    @Test
    void testMonthBounds() {
        assertTrue(evaluate(1, 2020).isEmpty());
        assertTrue(evaluate(12, 2020).isEmpty());
        assertTrue(evaluate(13, 2020).contains(FieldErrorCode.INVALID_EXPIRATION_MONTH));
        assertTrue(evaluate(-1, 2020).contains(FieldErrorCode.INVALID_EXPIRATION_MONTH));
    }

    @Test
    void testYearBounds() {
        assertTrue(evaluate(6, 1988).isEmpty());
        assertTrue(evaluate(6, 1987).contains(FieldErrorCode.INVALID_EXPIRATION_YEAR));
        assertTrue(evaluate(6, 9999).isEmpty());
        assertTrue(evaluate(6, 10000).contains(FieldErrorCode.INVALID_EXPIRATION_YEAR));
        assertTrue(evaluate(6, 10).contains(FieldErrorCode.INVALID_EXPIRATION_YEAR));
        assertTrue(evaluate(6, -2010).contains(FieldErrorCode.INVALID_EXPIRATION_YEAR));
    }

    @Test
    void testRuleName() {
        assertEquals("ExpirationDate", rule.getRuleName());
    }

    private ValidationErrors evaluate(Integer month, Integer year) {
        ValidationErrors errors = new ValidationErrors();
        rule.evaluate(CardToken.builder().month(month).year(year).build(), errors);
        return errors;
    }
}
